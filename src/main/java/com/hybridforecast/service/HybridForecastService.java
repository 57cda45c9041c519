package com.hybridforecast.service;

import com.hybridforecast.adapter.ForecastTableAdapter;
import com.hybridforecast.config.PipelineDefaults;
import com.hybridforecast.domain.ForecastHorizon;
import com.hybridforecast.domain.ForecastSource;
import com.hybridforecast.domain.HybridRecord;
import com.hybridforecast.domain.RawForecastRecord;
import com.hybridforecast.domain.ReconciledRecord;
import com.hybridforecast.domain.ReconciliationConfig;
import com.hybridforecast.domain.SegmentAssignment;
import com.hybridforecast.dto.HybridForecastRequest;
import com.hybridforecast.dto.HybridForecastResponse;
import com.hybridforecast.dto.ReconciliationResponse;
import com.hybridforecast.hybrid.HybridSelectionEngine;
import com.hybridforecast.hybrid.MidTermPassthrough;
import com.hybridforecast.reconciliation.ReconciliationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class HybridForecastService {

    private final ForecastTableAdapter tableAdapter;
    private final PipelineDefaults     pipelineDefaults;
    private final ReconciliationEngine reconciliationEngine;
    private final HybridSelectionEngine selectionEngine;
    private final MidTermPassthrough   midTermPassthrough;

    public ReconciliationResponse reconcile(HybridForecastRequest request, String requestId) {
        ReconciliationConfig config = pipelineDefaults.resolve(request.getConfig());
        List<ReconciledRecord> reconciled = runReconciliation(request, config, requestId);

        return ReconciliationResponse.builder()
            .generatedAt(Instant.now())
            .recordCount(reconciled.size())
            .midTermCount(countMidTerm(reconciled))
            .requestId(requestId)
            .records(reconciled)
            .build();
    }

    public HybridForecastResponse hybridForecast(HybridForecastRequest request, String requestId) {
        ReconciliationConfig config = pipelineDefaults.resolve(request.getConfig());
        List<ReconciledRecord> reconciled = runReconciliation(request, config, requestId);
        List<HybridRecord> hybrid = hybridize(reconciled, config.getZeroDemandThreshold());
        HybridForecastResponse.Summary summary = summarize(hybrid);

        log.info("Hybrid forecast | records={} | ml={} | ts={} | ensemble={} | requestId={}",
                 hybrid.size(), summary.getMlCount(), summary.getTsCount(),
                 summary.getEnsembleCount(), requestId);

        return HybridForecastResponse.builder()
            .generatedAt(Instant.now())
            .recordCount(hybrid.size())
            .reconciledCount(hybrid.size() - countMidTerm(reconciled))
            .midTermCount(countMidTerm(reconciled))
            .requestId(requestId)
            .summary(summary)
            .records(hybrid)
            .build();
    }

    /**
     * Short-term records go through the selection rules; mid-term records are passed
     * through on their TS value. Output keeps the input order.
     */
    public List<HybridRecord> hybridize(List<ReconciledRecord> reconciled, double zeroDemandThreshold) {
        List<HybridRecord> hybrid = new ArrayList<>(reconciled.size());
        for (ReconciledRecord record : reconciled) {
            hybrid.add(record.getHorizon() == ForecastHorizon.MID_TERM
                ? midTermPassthrough.passthrough(record)
                : selectionEngine.select(record, zeroDemandThreshold));
        }
        return hybrid;
    }

    private List<ReconciledRecord> runReconciliation(
            HybridForecastRequest request, ReconciliationConfig config, String requestId) {
        List<RawForecastRecord> ts = tableAdapter.toTsRecords(request.getTsForecast());
        List<RawForecastRecord> ml = tableAdapter.toMlRecords(request.getMlForecast());
        List<SegmentAssignment> segments = tableAdapter.toSegments(request.getSegments());

        log.info("Reconciliation started | ts={} | ml={} | segments={} | historyEnd={} | requestId={}",
                 ts.size(), ml.size(), segments.size(), config.getHistoryEndDate(), requestId);
        List<ReconciledRecord> reconciled = reconciliationEngine.reconcile(ts, ml, segments, config);
        log.info("Reconciliation finished | records={} | midTerm={} | requestId={}",
                 reconciled.size(), countMidTerm(reconciled), requestId);
        return reconciled;
    }

    private HybridForecastResponse.Summary summarize(List<HybridRecord> hybrid) {
        Map<ForecastSource, List<Double>> bySource = new EnumMap<>(ForecastSource.class);
        Map<ForecastSource, Integer> counts = new EnumMap<>(ForecastSource.class);
        for (HybridRecord record : hybrid) {
            counts.merge(record.getForecastSource(), 1, Integer::sum);
            bySource.computeIfAbsent(record.getForecastSource(), s -> new ArrayList<>())
                .add(record.getHybridForecastValue());
        }

        List<HybridForecastResponse.SourceStatistics> stats = new ArrayList<>();
        for (ForecastSource source : ForecastSource.values()) {
            if (counts.containsKey(source)) {
                stats.add(statistics(source, counts.get(source), bySource.get(source)));
            }
        }

        return HybridForecastResponse.Summary.builder()
            .mlCount(counts.getOrDefault(ForecastSource.ML, 0))
            .tsCount(counts.getOrDefault(ForecastSource.TS, 0))
            .ensembleCount(counts.getOrDefault(ForecastSource.ENSEMBLE, 0))
            .sources(stats)
            .build();
    }

    // Absent hybrid values count towards the record count but not the moments.
    private HybridForecastResponse.SourceStatistics statistics(ForecastSource source, int count, List<Double> values) {
        double[] present = values.stream().filter(Objects::nonNull).mapToDouble(Double::doubleValue).toArray();
        HybridForecastResponse.SourceStatistics.SourceStatisticsBuilder builder =
            HybridForecastResponse.SourceStatistics.builder().source(source).count(count);
        if (present.length == 0) {
            return builder.build();
        }

        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : present) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / present.length;
        Double std = null;
        if (present.length > 1) {
            double sq = 0.0;
            for (double v : present) {
                sq += (v - mean) * (v - mean);
            }
            std = round(Math.sqrt(sq / (present.length - 1)));
        }
        return builder.mean(round(mean)).std(std).min(round(min)).max(round(max)).build();
    }

    private int countMidTerm(List<ReconciledRecord> records) {
        return (int) records.stream().filter(r -> r.getHorizon() == ForecastHorizon.MID_TERM).count();
    }

    private double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
