package io.cronwarden;

import java.util.Objects;

/**
 * Outcome reported by a {@link ScheduledJob}. A failed result is recorded as an error
 * execution and counts toward the job's failure streak.
 *
 * @param success whether the run did its work
 * @param summary short human-readable description persisted with the execution
 * @param value   optional structured value (counts, remote response body, ...)
 */
public record JobResult(boolean success, String summary, Object value) {

    public JobResult {
        Objects.requireNonNull(summary, "summary must not be null");
    }

    public static JobResult ok(String summary) {
        return new JobResult(true, summary, null);
    }

    public static JobResult ok(String summary, Object value) {
        return new JobResult(true, summary, value);
    }

    public static JobResult failed(String reason) {
        return new JobResult(false, reason, null);
    }

    public static JobResult failed(String reason, Object value) {
        return new JobResult(false, reason, value);
    }
}
