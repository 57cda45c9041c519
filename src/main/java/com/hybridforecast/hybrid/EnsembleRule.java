package com.hybridforecast.hybrid;

import com.hybridforecast.domain.ForecastSource;

/**
 * Catch-all: average of whichever of TS and ML are present.
 */
public class EnsembleRule implements HybridRule {

    @Override
    public boolean matches(SelectionContext ctx) {
        return true;
    }

    @Override
    public HybridOutcome outcome(SelectionContext ctx) {
        Double ensemble = mean(ctx.tsValue(), ctx.mlValue());
        return new HybridOutcome(ForecastSource.ENSEMBLE, ensemble, ensemble);
    }

    /** Mean of the non-null, non-NaN arguments; null when there are none. */
    static Double mean(Double... values) {
        double sum = 0.0;
        int count = 0;
        for (Double v : values) {
            if (v != null && !v.isNaN()) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }
}
