package com.hybridforecast.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A forecast cell on the common grain. Short-term records are unique per
 * (key, period start); mid-term records carry the raw TS bucket.
 */
@Value
@Builder(toBuilder = true)
public class ReconciledRecord {
    DimensionalKey key;
    Period period;
    Double tsForecastValueRec;
    Double mlForecastValue;
    String demandType;
    String assortmentType;
    String segmentName;
    ForecastHorizon horizon;
}
