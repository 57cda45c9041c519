package com.hybridforecast.reconciliation;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Checks every (TS, ML) combination. O(|TS| x |ML|); only meant for small inputs
 * and as the reference the sort-merge join is verified against.
 */
@Component
@ConditionalOnProperty(name = "forecast.reconciliation.join-strategy", havingValue = "nested-loop")
public class NestedLoopIntervalJoin extends AbstractIntervalJoin {

    @Override
    protected void forEachOverlap(
            List<BucketedForecast> ts, List<BucketedForecast> ml,
            BiConsumer<BucketedForecast, BucketedForecast> onMatch) {
        for (BucketedForecast t : ts) {
            for (BucketedForecast m : ml) {
                if (t.key().equals(m.key()) && t.period().overlaps(m.period())) {
                    onMatch.accept(t, m);
                }
            }
        }
    }
}
