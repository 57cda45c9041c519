package com.hybridforecast.hybrid;

import com.hybridforecast.domain.ForecastSource;

/**
 * Retired and low-volume cells whose TS value is at or below the zero-demand threshold
 * keep the TS value.
 */
public class NearZeroTsRule implements HybridRule {

    @Override
    public boolean matches(SelectionContext ctx) {
        boolean fading = ctx.segmentName().equals("retired") || ctx.segmentName().equals("low volume");
        return fading && ctx.tsValue() != null && ctx.tsValue() <= ctx.zeroDemandThreshold();
    }

    @Override
    public HybridOutcome outcome(SelectionContext ctx) {
        return new HybridOutcome(ForecastSource.TS, ctx.tsValue(), null);
    }
}
