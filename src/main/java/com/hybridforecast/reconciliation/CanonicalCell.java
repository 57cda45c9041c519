package com.hybridforecast.reconciliation;

import com.hybridforecast.domain.DimensionalKey;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * Grouping key of the reconciled table: one output record per cell.
 */
public record CanonicalCell(DimensionalKey key, LocalDate periodStart) implements Comparable<CanonicalCell> {

    private static final Comparator<CanonicalCell> ORDER = Comparator
        .comparing(CanonicalCell::key)
        .thenComparing(CanonicalCell::periodStart);

    @Override
    public int compareTo(CanonicalCell other) {
        return ORDER.compare(this, other);
    }
}
