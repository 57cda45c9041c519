package com.hybridforecast.hybrid;

import com.hybridforecast.domain.ReconciledRecord;

import java.util.Locale;

/**
 * The fields the hybrid rules look at, normalized once per record: labels lower-cased
 * with absent labels as empty strings, and each forecast value falling back to the
 * other one when absent.
 */
public record SelectionContext(
    String demandType,
    String segmentName,
    String assortmentType,
    Double tsValue,
    Double mlValue,
    double zeroDemandThreshold
) {

    public static SelectionContext of(ReconciledRecord record, double zeroDemandThreshold) {
        Double ts = record.getTsForecastValueRec();
        Double ml = record.getMlForecastValue();
        return new SelectionContext(
            normalize(record.getDemandType()),
            normalize(record.getSegmentName()),
            normalize(record.getAssortmentType()),
            ts != null ? ts : ml,
            ml != null ? ml : ts,
            zeroDemandThreshold);
    }

    private static String normalize(String label) {
        return label == null ? "" : label.toLowerCase(Locale.ROOT);
    }
}
