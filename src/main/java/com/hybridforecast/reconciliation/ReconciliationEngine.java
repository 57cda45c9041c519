package com.hybridforecast.reconciliation;

import com.hybridforecast.domain.ForecastHorizon;
import com.hybridforecast.domain.Period;
import com.hybridforecast.domain.RawForecastRecord;
import com.hybridforecast.domain.ReconciledRecord;
import com.hybridforecast.domain.ReconciliationConfig;
import com.hybridforecast.domain.SegmentAssignment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Brings a TS forecast and an ML forecast onto one grain.
 * <ol>
 *   <li>TS buckets beyond {@code historyEnd + delayHorizon} are set aside as mid-term records.</li>
 *   <li>Missing period ends are inferred from the series time level.</li>
 *   <li>Buckets starting on or before the history end are dropped.</li>
 *   <li>Values are prorated to the days their period actually covers.</li>
 *   <li>TS and ML buckets are interval-joined per key.</li>
 *   <li>TS values are scaled onto the ML total of their cell and aggregated per cell.</li>
 *   <li>Segments are attached and the mid-term records appended.</li>
 * </ol>
 * The engine is stateless; every call works on its own copies of the input.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final IntervalJoinStrategy joinStrategy;
    private final RatioReconciler ratioReconciler;
    private final CanonicalAggregator aggregator;
    private final SegmentEnricher segmentEnricher;

    public List<ReconciledRecord> reconcile(
            List<RawForecastRecord> tsForecast,
            List<RawForecastRecord> mlForecast,
            List<SegmentAssignment> segments,
            ReconciliationConfig config) {

        List<RawForecastRecord> shortTermTs = new ArrayList<>();
        List<ReconciledRecord> midTerm = new ArrayList<>();
        splitHorizon(tsForecast, config, shortTermTs, midTerm);

        List<BucketedForecast> tsBuckets = bucket(shortTermTs, config.getTsTimeLevel(), config.getHistoryEndDate());
        List<BucketedForecast> mlBuckets = bucket(mlForecast, config.getMlTimeLevel(), config.getHistoryEndDate());
        log.debug("Bucketed | ts={} ({}, levels {}) | ml={} ({}, levels {}) | midTerm={}",
                  tsBuckets.size(), config.getTsTimeLevel(), config.getTsLevels(),
                  mlBuckets.size(), config.getMlTimeLevel(), config.getMlLevels(), midTerm.size());

        List<JoinedRow> joined = joinStrategy.join(tsBuckets, mlBuckets);
        List<JoinedRow> scaled = ratioReconciler.reconcile(joined);
        List<ReconciledRecord> reconciled = segmentEnricher.enrich(aggregator.aggregate(scaled), segments);
        log.debug("Reconciled | joinedRows={} | cells={}", joined.size(), reconciled.size());

        List<ReconciledRecord> result = new ArrayList<>(reconciled.size() + midTerm.size());
        result.addAll(reconciled);
        result.addAll(midTerm);
        return result;
    }

    private void splitHorizon(List<RawForecastRecord> tsForecast, ReconciliationConfig config,
                              List<RawForecastRecord> shortTerm, List<ReconciledRecord> midTerm) {
        if (!config.splitsMidTerm()) {
            shortTerm.addAll(tsForecast);
            return;
        }
        LocalDate cutoff = config.midTermCutoff();
        for (RawForecastRecord record : tsForecast) {
            if (record.getPeriodStart().isAfter(cutoff)) {
                midTerm.add(toMidTerm(record, config.getTsTimeLevel()));
            } else {
                shortTerm.add(record);
            }
        }
    }

    private ReconciledRecord toMidTerm(RawForecastRecord record, String timeLevel) {
        return ReconciledRecord.builder()
            .key(record.getKey())
            .period(periodOf(record, timeLevel))
            .tsForecastValueRec(record.getForecastValue())
            .mlForecastValue(null)
            .demandType(CanonicalAggregator.DEFAULT_DEMAND_TYPE)
            .assortmentType(CanonicalAggregator.DEFAULT_ASSORTMENT_TYPE)
            .segmentName(record.getSegmentName())
            .horizon(ForecastHorizon.MID_TERM)
            .build();
    }

    private List<BucketedForecast> bucket(List<RawForecastRecord> records, String timeLevel, LocalDate historyEnd) {
        List<BucketedForecast> buckets = new ArrayList<>(records.size());
        for (RawForecastRecord record : records) {
            if (!record.getPeriodStart().isAfter(historyEnd)) {
                continue;
            }
            Period period = periodOf(record, timeLevel);
            buckets.add(new BucketedForecast(
                buckets.size(),
                record.getKey(),
                period,
                TemporalApportionment.prorate(record.getForecastValue(), period, timeLevel),
                record.getDemandType(),
                record.getAssortmentType()));
        }
        return buckets;
    }

    private Period periodOf(RawForecastRecord record, String timeLevel) {
        LocalDate start = record.getPeriodStart();
        LocalDate end = record.getPeriodEnd() != null
            ? record.getPeriodEnd()
            : TemporalApportionment.periodEnd(timeLevel, start);
        return new Period(start, end);
    }
}
