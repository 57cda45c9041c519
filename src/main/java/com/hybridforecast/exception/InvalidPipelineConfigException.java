package com.hybridforecast.exception;

public class InvalidPipelineConfigException extends HybridForecastException {
    public InvalidPipelineConfigException(String message) {
        super("INVALID_PIPELINE_CONFIG", message);
    }
}
