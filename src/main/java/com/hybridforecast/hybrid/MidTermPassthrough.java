package com.hybridforecast.hybrid;

import com.hybridforecast.domain.ForecastSource;
import com.hybridforecast.domain.HybridRecord;
import com.hybridforecast.domain.ReconciledRecord;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Hybrid construction for TS-only records beyond the ML horizon. Segment, demand and
 * assortment labels are ignored.
 */
@Component
public class MidTermPassthrough {

    public List<HybridRecord> passthrough(List<ReconciledRecord> records) {
        return records.stream().map(this::passthrough).toList();
    }

    public HybridRecord passthrough(ReconciledRecord record) {
        return HybridRecord.builder()
            .reconciled(record)
            .hybridForecastValue(record.getTsForecastValueRec())
            .forecastSource(ForecastSource.TS)
            .ensembleForecastValue(null)
            .build();
    }
}
