package com.hybridforecast.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One row of a TS or ML forecast as handed over by the producing model.
 * {@code periodEnd} and every descriptive field are optional.
 */
@Value
@Builder(toBuilder = true)
public class RawForecastRecord {
    DimensionalKey key;
    LocalDate periodStart;
    LocalDate periodEnd;
    Double forecastValue;
    String demandType;
    String assortmentType;
    String segmentName;
}
