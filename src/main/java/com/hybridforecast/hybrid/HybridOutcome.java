package com.hybridforecast.hybrid;

import com.hybridforecast.domain.ForecastSource;

public record HybridOutcome(ForecastSource source, Double hybridValue, Double ensembleValue) {}
