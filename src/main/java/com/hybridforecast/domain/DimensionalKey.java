package com.hybridforecast.domain;

import java.util.Comparator;

/**
 * Identifies a forecastable cell: product, location, customer and distribution channel
 * at whatever hierarchy level the producing model reports.
 */
public record DimensionalKey(
    String productId,
    String locationId,
    String customerId,
    String distributionChannelId
) implements Comparable<DimensionalKey> {

    private static final Comparator<String> PART_ORDER =
        Comparator.nullsFirst(Comparator.<String>naturalOrder());

    private static final Comparator<DimensionalKey> ORDER = Comparator
        .comparing(DimensionalKey::productId, PART_ORDER)
        .thenComparing(DimensionalKey::locationId, PART_ORDER)
        .thenComparing(DimensionalKey::customerId, PART_ORDER)
        .thenComparing(DimensionalKey::distributionChannelId, PART_ORDER);

    @Override
    public int compareTo(DimensionalKey other) {
        return ORDER.compare(this, other);
    }
}
