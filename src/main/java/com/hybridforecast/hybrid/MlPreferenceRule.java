package com.hybridforecast.hybrid;

import com.hybridforecast.domain.ForecastSource;

/**
 * Promotional demand outside retired segments, short-lifecycle segments and new
 * assortment take the ML value.
 */
public class MlPreferenceRule implements HybridRule {

    @Override
    public boolean matches(SelectionContext ctx) {
        return (ctx.demandType().equals("promo") && !ctx.segmentName().equals("retired"))
            || ctx.segmentName().equals("short")
            || ctx.assortmentType().equals("new");
    }

    @Override
    public HybridOutcome outcome(SelectionContext ctx) {
        return new HybridOutcome(ForecastSource.ML, ctx.mlValue(), null);
    }
}
