package io.cronwarden.store;

import io.cronwarden.core.ThresholdBaseline;

import java.time.Instant;
import java.util.Optional;

/**
 * Change counters used by threshold triggers. Every mutating call is one atomic operation.
 */
public interface ThresholdBaselineStore {

    Optional<ThresholdBaseline> find(String jobId);

    /**
     * Return the baseline, creating it with a zero count if it does not exist yet. The stored
     * threshold is set to {@code threshold} either way.
     */
    ThresholdBaseline ensure(String jobId, long threshold);

    /**
     * Add {@code delta} to the current count.
     *
     * @return the count after the increment
     */
    long recordChanges(String jobId, long delta);

    /**
     * Record that the trigger is about to fire at {@code at}. Until {@link #reset} runs, the
     * baseline reports {@link ThresholdBaseline#pendingResetAt()}.
     */
    void markTriggered(String jobId, Instant at);

    /**
     * Drop a mark left by {@link #markTriggered} when the firing did not happen.
     */
    void clearPendingReset(String jobId);

    /**
     * Set the current count to zero, the last trigger time to {@code at} and clear any pending reset.
     */
    void reset(String jobId, Instant at);
}
