package com.hybridforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.hybridforecast.domain.ForecastSource;
import com.hybridforecast.domain.HybridRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class HybridForecastResponse {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    int recordCount;
    int reconciledCount;
    int midTermCount;
    String requestId;
    Summary summary;
    List<HybridRecord> records;

    @Value
    @Builder
    public static class Summary {
        int mlCount;
        int tsCount;
        int ensembleCount;
        List<SourceStatistics> sources;
    }

    /** Distribution of the hybrid values chosen from one source. */
    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SourceStatistics {
        ForecastSource source;
        int count;
        Double mean;
        Double std;
        Double min;
        Double max;
    }
}
