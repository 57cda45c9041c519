package com.hybridforecast.controller;

import com.hybridforecast.config.RequestIdFilter;
import com.hybridforecast.dto.AsyncJobResponse;
import com.hybridforecast.dto.HybridForecastRequest;
import com.hybridforecast.dto.HybridForecastResponse;
import com.hybridforecast.dto.ReconciliationResponse;
import com.hybridforecast.service.AsyncJobService;
import com.hybridforecast.service.HybridForecastService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HybridForecastController {

    private final HybridForecastService hybridForecastService;
    private final AsyncJobService       asyncJobService;

    @PostMapping("/reconciliations")
    public ResponseEntity<ReconciliationResponse> reconcile(
            @Valid @RequestBody HybridForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /reconciliations | ts={} | ml={} | requestId={}",
                 request.getTsForecast().size(), request.getMlForecast().size(), requestId);
        return ResponseEntity.ok(hybridForecastService.reconcile(request, requestId));
    }

    @PostMapping("/hybrid-forecasts")
    public ResponseEntity<HybridForecastResponse> hybridForecast(
            @Valid @RequestBody HybridForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /hybrid-forecasts | ts={} | ml={} | requestId={}",
                 request.getTsForecast().size(), request.getMlForecast().size(), requestId);
        return ResponseEntity.ok(hybridForecastService.hybridForecast(request, requestId));
    }

    @PostMapping("/hybrid-forecasts/async")
    public ResponseEntity<AsyncJobResponse> hybridForecastAsync(
            @Valid @RequestBody HybridForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        UUID jobId = asyncJobService.submit(
            "HYBRID_FORECAST",
            requestId,
            () -> hybridForecastService.hybridForecast(request, requestId)
        );
        return ResponseEntity.accepted()
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = RequestIdFilter.requestId(request);
        return id != null ? id : UUID.randomUUID().toString();
    }
}
