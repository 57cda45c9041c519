package com.hybridforecast.reconciliation;

import com.hybridforecast.domain.DimensionalKey;
import com.hybridforecast.domain.Period;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IntervalJoinTest {

    private static final DimensionalKey P1 = new DimensionalKey("P1", "L1", "C1", "CH1");
    private static final DimensionalKey P2 = new DimensionalKey("P2", "L1", "C1", "CH1");
    private static final DimensionalKey P3 = new DimensionalKey("P3", "L1", "C1", "CH1");

    private final SortMergeIntervalJoin sortMerge = new SortMergeIntervalJoin();
    private final NestedLoopIntervalJoin nestedLoop = new NestedLoopIntervalJoin();

    private static LocalDate jan(int day) {
        return LocalDate.of(2024, 1, day);
    }

    private static BucketedForecast bucket(int index, DimensionalKey key, LocalDate start, LocalDate end,
                                           Double value, String demandType) {
        return new BucketedForecast(index, key, new Period(start, end), value, demandType, null);
    }

    @Test
    void monthAgainstWeeks_splitsIntoIntersectionsAndApportionsBothSides() {
        List<BucketedForecast> ts = List.of(bucket(0, P1, jan(1), jan(31), 310.0, null));
        List<BucketedForecast> ml = List.of(
            bucket(0, P1, jan(1), jan(7), 70.0, "promo"),
            bucket(1, P1, jan(8), jan(14), 70.0, "regular"),
            bucket(2, P1, jan(29), LocalDate.of(2024, 2, 4), 70.0, "regular"));

        List<JoinedRow> rows = sortMerge.join(ts, ml);

        assertThat(rows).extracting(JoinedRow::period).containsExactly(
            new Period(jan(1), jan(7)),
            new Period(jan(8), jan(14)),
            new Period(jan(15), jan(28)),
            new Period(jan(29), jan(31)),
            new Period(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 4)));
        assertThat(rows).extracting(JoinedRow::tsValue).containsExactly(70.0, 70.0, 140.0, 30.0, 0.0);
        assertThat(rows).extracting(JoinedRow::mlValue).containsExactly(70.0, 70.0, null, 30.0, 40.0);
        assertThat(rows.get(0).demandType()).isEqualTo("promo");

        JoinedRow tsResidual = rows.get(2);
        assertThat(tsResidual.tsSourceIndex()).isZero();
        assertThat(tsResidual.hasMlSource()).isFalse();

        JoinedRow mlResidual = rows.get(4);
        assertThat(mlResidual.tsSourceIndex()).isEqualTo(JoinedRow.NO_SOURCE);
        assertThat(mlResidual.mlSourceIndex()).isEqualTo(2);
    }

    @Test
    void partlyCoveredBuckets_keepTheirWholeValue() {
        List<BucketedForecast> ts = List.of(bucket(0, P1, jan(1), jan(31), 310.0, null));
        List<BucketedForecast> ml = List.of(
            bucket(0, P1, LocalDate.of(2023, 12, 28), jan(3), 70.0, null),
            bucket(1, P1, jan(10), jan(16), 70.0, null),
            bucket(2, P1, jan(12), jan(18), 70.0, null));

        List<JoinedRow> rows = nestedLoop.join(ts, ml);

        double tsTotal = rows.stream().filter(r -> r.tsSourceIndex() == 0)
            .mapToDouble(JoinedRow::tsValue).sum();
        double firstMlTotal = rows.stream().filter(r -> r.mlSourceIndex() == 0)
            .mapToDouble(JoinedRow::mlValue).sum();
        // jan 12-16 is covered twice, so that share of TS is counted once per ML bucket
        assertThat(tsTotal).isCloseTo(310.0 + 50.0, within(1e-9));
        assertThat(firstMlTotal).isCloseTo(70.0, within(1e-9));
        assertThat(rows).filteredOn(r -> r.tsSourceIndex() == 0 && !r.hasMlSource())
            .extracting(JoinedRow::period)
            .containsExactly(new Period(jan(4), jan(9)), new Period(jan(19), jan(31)));
    }

    @Test
    void uncovered_mergesOverlappingCoverage() {
        Period month = new Period(jan(1), jan(31));

        assertThat(AbstractIntervalJoin.uncovered(month, List.of())).containsExactly(month);
        assertThat(AbstractIntervalJoin.uncovered(month, List.of(
                new Period(jan(20), jan(31)), new Period(jan(5), jan(10)), new Period(jan(8), jan(12)))))
            .containsExactly(new Period(jan(1), jan(4)), new Period(jan(13), jan(19)));
        assertThat(AbstractIntervalJoin.uncovered(month, List.of(month))).isEmpty();
    }

    @Test
    void unmatchedSides_areKeptWithFill() {
        List<BucketedForecast> ts = List.of(bucket(0, P2, jan(1), jan(1), 12.0, null));
        List<BucketedForecast> ml = List.of(bucket(0, P3, jan(1), jan(1), 40.0, "regular"));

        List<JoinedRow> rows = sortMerge.join(ts, ml);

        assertThat(rows).hasSize(2);
        JoinedRow tsOnly = rows.get(0);
        assertThat(tsOnly.key()).isEqualTo(P2);
        assertThat(tsOnly.tsValue()).isEqualTo(12.0);
        assertThat(tsOnly.mlValue()).isNull();
        assertThat(tsOnly.hasMlSource()).isFalse();

        JoinedRow mlOnly = rows.get(1);
        assertThat(mlOnly.key()).isEqualTo(P3);
        assertThat(mlOnly.tsValue()).isEqualTo(0.0);
        assertThat(mlOnly.mlValue()).isEqualTo(40.0);
        assertThat(mlOnly.tsSourceIndex()).isEqualTo(JoinedRow.NO_SOURCE);
    }

    @Test
    void keysMustMatchExactly() {
        DimensionalKey otherChannel = new DimensionalKey("P1", "L1", "C1", "CH2");
        List<BucketedForecast> ts = List.of(bucket(0, P1, jan(1), jan(7), 7.0, null));
        List<BucketedForecast> ml = List.of(bucket(0, otherChannel, jan(1), jan(7), 7.0, null));

        assertThat(sortMerge.join(ts, ml)).noneMatch(r -> r.hasMlSource() && r.tsSourceIndex() >= 0);
    }

    @Test
    void touchingBoundsOverlap_adjacentBoundsDoNot() {
        List<BucketedForecast> ts = List.of(bucket(0, P1, jan(1), jan(7), 7.0, null));
        List<BucketedForecast> ml = List.of(
            bucket(0, P1, jan(7), jan(13), 7.0, null),
            bucket(1, P1, jan(8), jan(14), 7.0, null));

        List<JoinedRow> rows = sortMerge.join(ts, ml);

        JoinedRow matched = rows.stream()
            .filter(r -> r.tsSourceIndex() == 0 && r.hasMlSource())
            .findFirst().orElseThrow();
        assertThat(matched.period()).isEqualTo(new Period(jan(7), jan(7)));
        assertThat(matched.mlSourceIndex()).isZero();
        assertThat(rows).anyMatch(r -> r.mlSourceIndex() == 1 && r.tsSourceIndex() == JoinedRow.NO_SOURCE);
        assertThat(rows).anyMatch(r -> r.tsSourceIndex() == 0 && !r.hasMlSource()
            && r.period().equals(new Period(jan(1), jan(6))));
        assertThat(rows).anyMatch(r -> r.mlSourceIndex() == 0 && r.tsSourceIndex() == JoinedRow.NO_SOURCE
            && r.period().equals(new Period(jan(8), jan(13))));
    }

    @Test
    void sortMerge_matchesNestedLoopOnIrregularBuckets() {
        Random random = new Random(42);
        List<DimensionalKey> keys = List.of(P1, P2, P3);
        List<BucketedForecast> ts = new ArrayList<>();
        List<BucketedForecast> ml = new ArrayList<>();
        LocalDate origin = LocalDate.of(2024, 1, 1);

        for (int i = 0; i < 60; i++) {
            LocalDate start = origin.plusDays(random.nextInt(120));
            ts.add(bucket(i, keys.get(random.nextInt(keys.size())), start,
                start.plusDays(random.nextInt(31)), random.nextDouble() * 100, null));
        }
        for (int i = 0; i < 90; i++) {
            LocalDate start = origin.plusDays(random.nextInt(120));
            Double value = random.nextInt(10) == 0 ? null : random.nextDouble() * 100;
            ml.add(bucket(i, keys.get(random.nextInt(keys.size())), start,
                start.plusDays(random.nextInt(14)), value, random.nextBoolean() ? "promo" : "regular"));
        }

        List<JoinedRow> expected = nestedLoop.join(ts, ml);
        List<JoinedRow> actual = sortMerge.join(ts, ml);

        assertThat(actual).isNotEmpty().containsExactlyElementsOf(expected);
    }
}
