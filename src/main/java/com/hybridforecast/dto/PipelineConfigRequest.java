package com.hybridforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Per-request overrides of the pipeline defaults. Every field is optional.
 */
@Value
@Builder
@Jacksonized
public class PipelineConfigRequest {

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate historyEndDate;

    @Min(value = 0, message = "forecastHorizonDays must be >= 0")
    Integer forecastHorizonDays;

    @Min(value = 0, message = "delayHorizonDays must be >= 0")
    Integer delayHorizonDays;

    String tsTimeLevel;
    String mlTimeLevel;

    @Min(value = 1, message = "tsProductLevel must be >= 1")
    Integer tsProductLevel;
    @Min(value = 1, message = "tsLocationLevel must be >= 1")
    Integer tsLocationLevel;
    @Min(value = 1, message = "tsCustomerLevel must be >= 1")
    Integer tsCustomerLevel;
    @Min(value = 1, message = "tsChannelLevel must be >= 1")
    Integer tsChannelLevel;

    @Min(value = 1, message = "mlProductLevel must be >= 1")
    Integer mlProductLevel;
    @Min(value = 1, message = "mlLocationLevel must be >= 1")
    Integer mlLocationLevel;
    @Min(value = 1, message = "mlCustomerLevel must be >= 1")
    Integer mlCustomerLevel;
    @Min(value = 1, message = "mlChannelLevel must be >= 1")
    Integer mlChannelLevel;

    @DecimalMin(value = "0.0", message = "zeroDemandThreshold must be >= 0")
    Double zeroDemandThreshold;
}
