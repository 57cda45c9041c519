package com.hybridforecast.reconciliation;

import com.hybridforecast.domain.DimensionalKey;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Partitions both series by key, sorts each partition by period start and sweeps the
 * TS buckets over the ML buckets. ML buckets that end before the current TS start are
 * never revisited, so contiguous bucket series are joined in linear time per key.
 */
@Component
@ConditionalOnProperty(name = "forecast.reconciliation.join-strategy", havingValue = "sort-merge", matchIfMissing = true)
public class SortMergeIntervalJoin extends AbstractIntervalJoin {

    private static final Comparator<BucketedForecast> BY_START = Comparator
        .comparing((BucketedForecast b) -> b.period().start())
        .thenComparing(b -> b.period().end())
        .thenComparingInt(BucketedForecast::sourceIndex);

    @Override
    protected void forEachOverlap(
            List<BucketedForecast> ts, List<BucketedForecast> ml,
            BiConsumer<BucketedForecast, BucketedForecast> onMatch) {
        Map<DimensionalKey, List<BucketedForecast>> tsByKey = partition(ts);
        Map<DimensionalKey, List<BucketedForecast>> mlByKey = partition(ml);

        for (Map.Entry<DimensionalKey, List<BucketedForecast>> entry : tsByKey.entrySet()) {
            List<BucketedForecast> mlBuckets = mlByKey.get(entry.getKey());
            if (mlBuckets != null) {
                sweep(entry.getValue(), mlBuckets, onMatch);
            }
        }
    }

    private void sweep(List<BucketedForecast> ts, List<BucketedForecast> ml,
                       BiConsumer<BucketedForecast, BucketedForecast> onMatch) {
        int low = 0;
        for (BucketedForecast t : ts) {
            while (low < ml.size() && ml.get(low).period().end().isBefore(t.period().start())) {
                low++;
            }
            for (int i = low; i < ml.size(); i++) {
                BucketedForecast m = ml.get(i);
                if (m.period().start().isAfter(t.period().end())) {
                    break;
                }
                if (!m.period().end().isBefore(t.period().start())) {
                    onMatch.accept(t, m);
                }
            }
        }
    }

    private Map<DimensionalKey, List<BucketedForecast>> partition(List<BucketedForecast> buckets) {
        Map<DimensionalKey, List<BucketedForecast>> byKey = new TreeMap<>();
        for (BucketedForecast bucket : buckets) {
            byKey.computeIfAbsent(bucket.key(), k -> new ArrayList<>()).add(bucket);
        }
        byKey.values().forEach(list -> list.sort(BY_START));
        return byKey;
    }
}
