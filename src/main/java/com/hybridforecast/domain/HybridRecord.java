package com.hybridforecast.domain;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Builder;
import lombok.Value;

/**
 * Terminal artifact of the pipeline. {@code ensembleForecastValue} is only ever
 * populated when {@code forecastSource} is {@link ForecastSource#ENSEMBLE}.
 */
@Value
@Builder
public class HybridRecord {
    @JsonUnwrapped
    ReconciledRecord reconciled;
    Double hybridForecastValue;
    ForecastSource forecastSource;
    Double ensembleForecastValue;
}
