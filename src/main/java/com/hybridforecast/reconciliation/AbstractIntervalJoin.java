package com.hybridforecast.reconciliation;

import com.hybridforecast.domain.Period;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Builds joined rows from the overlapping pairs an implementation enumerates.
 * Matched pairs are cut down to the intersection of both periods and each side
 * contributes the part of its value falling inside that intersection.
 * <p>
 * Days of a bucket that no bucket of the other series covers are emitted as residual
 * rows carrying the matching share of the value: TS residuals with ML absent, ML
 * residuals with TS 0. A bucket without any overlap is one residual over its whole
 * period, so the value of every bucket is fully accounted for.
 */
public abstract class AbstractIntervalJoin implements IntervalJoinStrategy {

    private static final Comparator<Period> BY_START = Comparator.comparing(Period::start);

    @Override
    public final List<JoinedRow> join(List<BucketedForecast> ts, List<BucketedForecast> ml) {
        List<List<Period>> tsCovered = coverage(ts.size());
        List<List<Period>> mlCovered = coverage(ml.size());
        List<JoinedRow> rows = new ArrayList<>();

        forEachOverlap(ts, ml, (t, m) -> {
            Period overlap = t.period().intersect(m.period());
            tsCovered.get(t.sourceIndex()).add(overlap);
            mlCovered.get(m.sourceIndex()).add(overlap);
            rows.add(new JoinedRow(
                t.key(),
                overlap,
                TemporalApportionment.share(t.value(), t.period(), overlap),
                TemporalApportionment.share(m.value(), m.period(), overlap),
                m.demandType(),
                m.assortmentType(),
                t.sourceIndex(),
                m.sourceIndex()));
        });

        for (BucketedForecast t : ts) {
            for (Period gap : uncovered(t.period(), tsCovered.get(t.sourceIndex()))) {
                rows.add(new JoinedRow(t.key(), gap, portion(t, gap), null,
                    t.demandType(), t.assortmentType(), t.sourceIndex(), JoinedRow.NO_SOURCE));
            }
        }
        for (BucketedForecast m : ml) {
            for (Period gap : uncovered(m.period(), mlCovered.get(m.sourceIndex()))) {
                rows.add(new JoinedRow(m.key(), gap, 0.0, portion(m, gap),
                    m.demandType(), m.assortmentType(), JoinedRow.NO_SOURCE, m.sourceIndex()));
            }
        }

        rows.sort(JoinedRow.ORDER);
        return rows;
    }

    /**
     * Calls {@code onMatch} once for every (TS, ML) pair with equal keys and overlapping
     * periods. Buckets carry their position in the given list as {@code sourceIndex}.
     */
    protected abstract void forEachOverlap(
        List<BucketedForecast> ts, List<BucketedForecast> ml,
        BiConsumer<BucketedForecast, BucketedForecast> onMatch);

    /** Sub-periods of {@code period} outside every covered interval, in date order. */
    static List<Period> uncovered(Period period, List<Period> covered) {
        if (covered.isEmpty()) {
            return List.of(period);
        }
        List<Period> sorted = new ArrayList<>(covered);
        sorted.sort(BY_START);

        List<Period> gaps = new ArrayList<>();
        LocalDate cursor = period.start();
        for (Period c : sorted) {
            if (c.start().isAfter(cursor)) {
                gaps.add(new Period(cursor, c.start().minusDays(1)));
            }
            LocalDate next = c.end().plusDays(1);
            if (next.isAfter(cursor)) {
                cursor = next;
            }
        }
        if (!cursor.isAfter(period.end())) {
            gaps.add(new Period(cursor, period.end()));
        }
        return gaps;
    }

    private static Double portion(BucketedForecast bucket, Period gap) {
        return gap.equals(bucket.period())
            ? bucket.value()
            : TemporalApportionment.share(bucket.value(), bucket.period(), gap);
    }

    private static List<List<Period>> coverage(int size) {
        List<List<Period>> covered = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            covered.add(new ArrayList<>());
        }
        return covered;
    }
}
