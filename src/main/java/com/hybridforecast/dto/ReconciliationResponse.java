package com.hybridforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.hybridforecast.domain.ReconciledRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ReconciliationResponse {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    int recordCount;
    int midTermCount;
    String requestId;
    List<ReconciledRecord> records;
}
