package io.cronwarden.store;

import io.cronwarden.core.ExecutionRecord;
import io.cronwarden.core.FailureStreak;
import io.cronwarden.core.JobDefinition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for execution history and per-job state.
 *
 * <p>Failure counters must be updated with a single atomic operation per call.
 */
public interface ExecutionStore {

    /**
     * Create or refresh the job's state entry without touching its counters.
     */
    void registerJob(JobDefinition definition);

    void insertStarted(ExecutionRecord record);

    void complete(ExecutionRecord record);

    /**
     * Most recent executions of a job, newest first.
     */
    List<ExecutionRecord> recent(String jobId, int limit);

    /**
     * Atomically add one to the job's consecutive failure count.
     *
     * @return the count after the increment
     */
    int incrementFailures(String jobId, Instant at);

    /**
     * Set the consecutive failure count to zero and mark a successful run.
     */
    void resetFailures(String jobId, Instant at);

    Optional<FailureStreak> failureStreak(String jobId);
}
