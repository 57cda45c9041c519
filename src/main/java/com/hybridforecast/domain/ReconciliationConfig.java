package com.hybridforecast.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
public class ReconciliationConfig {

    public static final double DEFAULT_ZERO_DEMAND_THRESHOLD = 0.01;

    @Builder.Default
    LocalDate historyEndDate = LocalDate.now();

    @Builder.Default
    int forecastHorizonDays = 90;

    @Builder.Default
    int delayHorizonDays = 0;

    @Builder.Default
    HierarchyLevels tsLevels = HierarchyLevels.TS_DEFAULT;

    @Builder.Default
    String tsTimeLevel = "MONTH";

    @Builder.Default
    HierarchyLevels mlLevels = HierarchyLevels.ML_DEFAULT;

    @Builder.Default
    String mlTimeLevel = "WEEK.2";

    @Builder.Default
    double zeroDemandThreshold = DEFAULT_ZERO_DEMAND_THRESHOLD;

    /** Periods starting strictly after this date bypass reconciliation. */
    public LocalDate midTermCutoff() {
        return historyEndDate.plusDays(delayHorizonDays);
    }

    public boolean splitsMidTerm() {
        return forecastHorizonDays > delayHorizonDays;
    }
}
