package io.cronwarden.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One run of one job. Written when the run starts (status {@link ExecutionStatus#RUNNING},
 * no completion time) and completed exactly once.
 */
public record ExecutionRecord(
        String id,
        String jobId,
        Instant startedAt,
        Instant completedAt,
        ExecutionStatus status,
        String resultSummary,
        Long durationMs
) {
    public ExecutionRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public static ExecutionRecord started(String jobId, Instant startedAt) {
        return new ExecutionRecord(UUID.randomUUID().toString(), jobId, startedAt, null, ExecutionStatus.RUNNING, null, null);
    }

    public ExecutionRecord complete(Instant completedAt, ExecutionStatus status, String resultSummary) {
        if (this.completedAt != null) {
            throw new IllegalStateException("Execution already completed: " + id);
        }
        long duration = Math.max(0, Duration.between(startedAt, completedAt).toMillis());
        return new ExecutionRecord(id, jobId, startedAt, completedAt, status, resultSummary, duration);
    }

    public boolean isCompleted() {
        return completedAt != null;
    }
}
