package com.hybridforecast.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Both forecast series and the optional segment lookup as rows of column/value pairs.
 * Column names are resolved by {@link com.hybridforecast.adapter.ForecastTableAdapter}.
 */
@Value
@Builder
@Jacksonized
public class HybridForecastRequest {

    @NotEmpty(message = "tsForecast must not be empty")
    @Size(max = 200000, message = "tsForecast supports up to 200000 rows")
    List<Map<String, Object>> tsForecast;

    @NotNull(message = "mlForecast is required")
    @Size(max = 200000, message = "mlForecast supports up to 200000 rows")
    @Builder.Default
    List<Map<String, Object>> mlForecast = List.of();

    List<Map<String, Object>> segments;

    @Valid
    PipelineConfigRequest config;
}
