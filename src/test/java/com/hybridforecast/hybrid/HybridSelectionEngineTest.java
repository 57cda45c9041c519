package com.hybridforecast.hybrid;

import com.hybridforecast.domain.DimensionalKey;
import com.hybridforecast.domain.ForecastSource;
import com.hybridforecast.domain.HybridRecord;
import com.hybridforecast.domain.ReconciledRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HybridSelectionEngineTest {

    private static final double THRESHOLD = 0.01;
    private static final DimensionalKey KEY = new DimensionalKey("P1", "L1", "C1", "CH1");

    private final HybridSelectionEngine engine = new HybridSelectionEngine();

    private static ReconciledRecord record(String demand, String segment, String assortment, Double ts, Double ml) {
        return ReconciledRecord.builder()
            .key(KEY)
            .demandType(demand)
            .segmentName(segment)
            .assortmentType(assortment)
            .tsForecastValueRec(ts)
            .mlForecastValue(ml)
            .build();
    }

    @Test
    void promoOnRegularSegment_takesMl() {
        HybridRecord result = engine.select(record("promo", "Regular", "old", 80.0, 120.0), THRESHOLD);

        assertThat(result.getForecastSource()).isEqualTo(ForecastSource.ML);
        assertThat(result.getHybridForecastValue()).isEqualTo(120.0);
        assertThat(result.getEnsembleForecastValue()).isNull();
    }

    @Test
    void shortSegmentOrNewAssortment_takesMl() {
        assertThat(engine.select(record("regular", "Short", "old", 5.0, 7.0), THRESHOLD).getForecastSource())
            .isEqualTo(ForecastSource.ML);
        assertThat(engine.select(record("regular", "Regular", "new", 5.0, 7.0), THRESHOLD).getForecastSource())
            .isEqualTo(ForecastSource.ML);
    }

    @Test
    void retiredNearZero_takesTs() {
        HybridRecord result = engine.select(record("regular", "Retired", "old", 0.005, 50.0), THRESHOLD);

        assertThat(result.getForecastSource()).isEqualTo(ForecastSource.TS);
        assertThat(result.getHybridForecastValue()).isEqualTo(0.005);
        assertThat(result.getEnsembleForecastValue()).isNull();
    }

    @Test
    void lowVolumeAtThreshold_takesTs() {
        HybridRecord result = engine.select(record("regular", "Low Volume", "old", 0.01, 3.0), THRESHOLD);

        assertThat(result.getForecastSource()).isEqualTo(ForecastSource.TS);
    }

    @Test
    void regularRecord_averagesBoth() {
        HybridRecord result = engine.select(record("regular", "Regular", "old", 75.0, 85.0), THRESHOLD);

        assertThat(result.getForecastSource()).isEqualTo(ForecastSource.ENSEMBLE);
        assertThat(result.getHybridForecastValue()).isEqualTo(80.0);
        assertThat(result.getEnsembleForecastValue()).isEqualTo(80.0);
    }

    @Test
    void mlRuleTakesPrecedenceOverNearZeroRule() {
        HybridRecord shortSegment = engine.select(record("regular", "Short", "old", 0.001, 9.0), THRESHOLD);
        HybridRecord newLowVolume = engine.select(record("regular", "Low Volume", "new", 0.001, 9.0), THRESHOLD);

        assertThat(shortSegment.getForecastSource()).isEqualTo(ForecastSource.ML);
        assertThat(newLowVolume.getForecastSource()).isEqualTo(ForecastSource.ML);
    }

    @Test
    void promoOnRetiredSegment_isNotForcedToMl() {
        assertThat(engine.select(record("promo", "Retired", "old", 0.005, 40.0), THRESHOLD).getForecastSource())
            .isEqualTo(ForecastSource.TS);
        assertThat(engine.select(record("promo", "Retired", "old", 5.0, 40.0), THRESHOLD).getForecastSource())
            .isEqualTo(ForecastSource.ENSEMBLE);
    }

    @Test
    void labelsCompareCaseInsensitively() {
        assertThat(engine.select(record("PROMO", "REGULAR", "OLD", 1.0, 2.0), THRESHOLD).getForecastSource())
            .isEqualTo(ForecastSource.ML);
        assertThat(engine.select(record("Regular", "rEtIrEd", "Old", 0.0, 2.0), THRESHOLD).getForecastSource())
            .isEqualTo(ForecastSource.TS);
    }

    @Test
    void absentValuesFallBackToTheOtherSeries() {
        HybridRecord mlOnly = engine.select(record("regular", "Regular", "old", null, 55.0), THRESHOLD);
        assertThat(mlOnly.getHybridForecastValue()).isEqualTo(55.0);

        HybridRecord tsOnly = engine.select(record("promo", "Regular", "old", 45.0, null), THRESHOLD);
        assertThat(tsOnly.getForecastSource()).isEqualTo(ForecastSource.ML);
        assertThat(tsOnly.getHybridForecastValue()).isEqualTo(45.0);

        HybridRecord neither = engine.select(record(null, null, null, null, null), THRESHOLD);
        assertThat(neither.getForecastSource()).isEqualTo(ForecastSource.ENSEMBLE);
        assertThat(neither.getHybridForecastValue()).isNull();
        assertThat(neither.getEnsembleForecastValue()).isNull();
    }

    @Test
    void thresholdIsConfigurable() {
        ReconciledRecord lowVolume = record("regular", "Low Volume", "old", 0.5, 1.5);

        assertThat(engine.select(lowVolume, 1.0).getForecastSource()).isEqualTo(ForecastSource.TS);
        HybridRecord strict = engine.select(lowVolume, THRESHOLD);
        assertThat(strict.getForecastSource()).isEqualTo(ForecastSource.ENSEMBLE);
        assertThat(strict.getHybridForecastValue()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void ensembleValuePresentOnlyForEnsembleSource() {
        List<ReconciledRecord> records = List.of(
            record("promo", "Regular", "old", 1.0, 2.0),
            record("regular", "Retired", "old", 0.0, 2.0),
            record("regular", "Regular", "old", 3.0, 2.0),
            record("regular", "Low Volume", "new", 0.0, 2.0),
            record(null, "Regular", null, null, 6.0));

        List<HybridRecord> results = engine.select(records, THRESHOLD);

        assertThat(results).hasSameSizeAs(records);
        assertThat(results).allSatisfy(r ->
            assertThat(r.getEnsembleForecastValue() != null)
                .isEqualTo(r.getForecastSource() == ForecastSource.ENSEMBLE));
        assertThat(results).extracting(HybridRecord::getReconciled).containsExactlyElementsOf(records);
    }

    @Test
    void mean_skipsAbsentAndNaN() {
        assertThat(EnsembleRule.mean(2.0, null)).isEqualTo(2.0);
        assertThat(EnsembleRule.mean(Double.NaN, 4.0)).isEqualTo(4.0);
        assertThat(EnsembleRule.mean(null, null)).isNull();
    }
}
