package com.hybridforecast.exception;

public class ForecastTableFormatException extends HybridForecastException {
    public ForecastTableFormatException(String table, int row, String message) {
        super("FORECAST_TABLE_FORMAT", table + " row " + row + ": " + message);
    }

    public ForecastTableFormatException(String table, int row, String message, Throwable cause) {
        super("FORECAST_TABLE_FORMAT", table + " row " + row + ": " + message, cause);
    }
}
