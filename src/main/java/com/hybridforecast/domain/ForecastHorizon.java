package com.hybridforecast.domain;

/**
 * Which path produced a reconciled record.
 */
public enum ForecastHorizon {
    /** Joined with ML coverage and ratio-reconciled. */
    SHORT_TERM,
    /** Beyond the delay horizon; TS value passed through without ML coverage. */
    MID_TERM
}
