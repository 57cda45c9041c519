package com.hybridforecast.reconciliation;

import com.hybridforecast.domain.DimensionalKey;
import com.hybridforecast.domain.Period;

/**
 * A forecast record after bound inference, history filtering and apportionment.
 * {@code sourceIndex} is the record's position in the series handed to the join.
 */
public record BucketedForecast(
    int sourceIndex,
    DimensionalKey key,
    Period period,
    Double value,
    String demandType,
    String assortmentType
) {}
