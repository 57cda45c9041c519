package com.hybridforecast.exception;

import lombok.Getter;

@Getter
public abstract class HybridForecastException extends RuntimeException {
    private final String errorCode;

    protected HybridForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected HybridForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
