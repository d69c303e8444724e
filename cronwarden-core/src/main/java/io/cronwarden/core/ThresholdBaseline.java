package io.cronwarden.core;

import java.time.Instant;

/**
 * Change counter a threshold trigger compares against. {@code currentCount} grows as
 * producers record changes and is reset to zero when the trigger fires.
 *
 * <p>{@code pendingResetAt} is set while a firing has been claimed but the counter has not
 * been reset yet. A baseline carrying it is reset on the next pass, never fired again.
 */
public record ThresholdBaseline(String jobId,
                                Instant lastTriggerAt,
                                long currentCount,
                                long threshold,
                                Instant pendingResetAt) {

    public static ThresholdBaseline empty(String jobId, long threshold) {
        return new ThresholdBaseline(jobId, null, 0, threshold, null);
    }

    public boolean reached() {
        return currentCount >= threshold;
    }

    public boolean resetPending() {
        return pendingResetAt != null;
    }
}
