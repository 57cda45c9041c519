package com.hybridforecast.reconciliation;

import com.hybridforecast.domain.DimensionalKey;
import com.hybridforecast.domain.Period;

import java.util.Comparator;

/**
 * Output of the interval join. Source indexes are -1 on the side that had no match.
 */
public record JoinedRow(
    DimensionalKey key,
    Period period,
    Double tsValue,
    Double mlValue,
    String demandType,
    String assortmentType,
    int tsSourceIndex,
    int mlSourceIndex
) {

    public static final int NO_SOURCE = -1;

    static final Comparator<JoinedRow> ORDER = Comparator
        .comparing(JoinedRow::key)
        .thenComparing(r -> r.period().start())
        .thenComparing(r -> r.period().end())
        .thenComparingInt(JoinedRow::tsSourceIndex)
        .thenComparingInt(JoinedRow::mlSourceIndex);

    public CanonicalCell cell() {
        return new CanonicalCell(key, period.start());
    }

    public boolean hasMlSource() {
        return mlSourceIndex != NO_SOURCE;
    }

    public JoinedRow withTsValue(Double value) {
        return new JoinedRow(key, period, value, mlValue, demandType, assortmentType, tsSourceIndex, mlSourceIndex);
    }
}
