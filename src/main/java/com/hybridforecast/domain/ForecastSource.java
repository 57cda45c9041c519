package com.hybridforecast.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastSource {
    ML("ml"),
    TS("ts"),
    ENSEMBLE("ensemble");

    private final String label;

    ForecastSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
