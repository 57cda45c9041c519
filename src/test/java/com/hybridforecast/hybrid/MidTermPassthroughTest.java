package com.hybridforecast.hybrid;

import com.hybridforecast.domain.DimensionalKey;
import com.hybridforecast.domain.ForecastHorizon;
import com.hybridforecast.domain.ForecastSource;
import com.hybridforecast.domain.HybridRecord;
import com.hybridforecast.domain.ReconciledRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MidTermPassthroughTest {

    private final MidTermPassthrough passthrough = new MidTermPassthrough();

    private static ReconciledRecord midTerm(String demand, String segment, String assortment, Double ts) {
        return ReconciledRecord.builder()
            .key(new DimensionalKey("P9", "L1", "C1", "CH1"))
            .demandType(demand)
            .segmentName(segment)
            .assortmentType(assortment)
            .tsForecastValueRec(ts)
            .horizon(ForecastHorizon.MID_TERM)
            .build();
    }

    @Test
    void passthrough_alwaysTakesTsWhateverTheLabels() {
        List<ReconciledRecord> records = List.of(
            midTerm("promo", "Short", "new", 100.0),
            midTerm("regular", "Low Volume", "old", 0.0),
            midTerm("regular", "Regular", "old", null));

        List<HybridRecord> results = passthrough.passthrough(records);

        assertThat(results).extracting(HybridRecord::getForecastSource).containsOnly(ForecastSource.TS);
        assertThat(results).extracting(HybridRecord::getHybridForecastValue).containsExactly(100.0, 0.0, null);
        assertThat(results).extracting(HybridRecord::getEnsembleForecastValue).containsOnlyNulls();
    }
}
