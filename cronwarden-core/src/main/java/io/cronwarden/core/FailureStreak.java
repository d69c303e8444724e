package io.cronwarden.core;

import java.time.Instant;

/**
 * Current-value state of a job's recent health.
 */
public record FailureStreak(String jobId, int consecutiveFailures, Instant lastRunAt, Instant lastSuccessfulRun) {

    public static FailureStreak none(String jobId) {
        return new FailureStreak(jobId, 0, null, null);
    }
}
