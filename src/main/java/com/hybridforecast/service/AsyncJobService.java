package com.hybridforecast.service;

import com.hybridforecast.dto.AsyncJobResponse;
import com.hybridforecast.dto.AsyncJobStatus;
import com.hybridforecast.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs large pipeline requests off the request thread. Finished jobs are kept for
 * polling until {@code jobs.max-retained} is exceeded, oldest first.
 */
@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:2}")
    private int poolSize;

    @Value("${jobs.max-retained:500}")
    private int maxRetained;

    private ExecutorService executor;
    private final Map<UUID, PipelineJob> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
        log.info("AsyncJobService started | poolSize={} | maxRetained={}", Math.max(1, poolSize), maxRetained);
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(String jobType, String requestId, Supplier<?> pipeline) {
        PipelineJob job = new PipelineJob(UUID.randomUUID(), jobType, requestId);
        jobs.put(job.jobId, job);
        evictFinished();
        executor.execute(() -> run(job, pipeline));
        log.info("Job queued | jobId={} | type={} | requestId={}", job.jobId, jobType, requestId);
        return job.jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        PipelineJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job.snapshot();
    }

    private void run(PipelineJob job, Supplier<?> pipeline) {
        job.start();
        try {
            job.complete(pipeline.get());
            log.info("Job completed | jobId={} | requestId={}", job.jobId, job.requestId);
        } catch (RuntimeException ex) {
            String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            job.fail(reason);
            log.warn("Job failed | jobId={} | requestId={} | reason={}", job.jobId, job.requestId, reason, ex);
        }
    }

    private void evictFinished() {
        int excess = jobs.size() - maxRetained;
        if (excess <= 0) {
            return;
        }
        jobs.values().stream()
            .filter(PipelineJob::isFinished)
            .sorted(Comparator.comparing((PipelineJob j) -> j.submittedAt))
            .limit(excess)
            .map(j -> j.jobId)
            .toList()
            .forEach(jobs::remove);
    }

    private static final class PipelineJob {
        private final UUID jobId;
        private final String jobType;
        private final String requestId;
        private final Instant submittedAt = Instant.now();
        private Instant startedAt;
        private Instant finishedAt;
        private AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private String message = "Queued";
        private Object result;

        private PipelineJob(UUID jobId, String jobType, String requestId) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.requestId = requestId;
        }

        private synchronized void start() {
            startedAt = Instant.now();
            status = AsyncJobStatus.RUNNING;
            message = "Running";
        }

        private synchronized void complete(Object output) {
            finishedAt = Instant.now();
            status = AsyncJobStatus.COMPLETED;
            message = "Completed";
            result = output;
        }

        private synchronized void fail(String reason) {
            finishedAt = Instant.now();
            status = AsyncJobStatus.FAILED;
            message = reason;
        }

        private synchronized boolean isFinished() {
            return status == AsyncJobStatus.COMPLETED || status == AsyncJobStatus.FAILED;
        }

        private synchronized AsyncJobResponse snapshot() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .submittedAt(submittedAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .message(message)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
