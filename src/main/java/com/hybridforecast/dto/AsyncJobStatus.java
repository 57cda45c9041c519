package com.hybridforecast.dto;

public enum AsyncJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
