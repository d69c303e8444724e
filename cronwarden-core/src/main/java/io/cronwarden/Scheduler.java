package io.cronwarden;

import io.cronwarden.core.ExecutionRecord;
import io.cronwarden.core.JobStatus;

import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>The scheduler owns the job registry, the set of running jobs and the enabled flags.
 * It evaluates schedules once per wall-clock minute and starts each due job that is not
 * already running.
 */
public interface Scheduler {

    /**
     * Start the minute dispatcher. Idempotent.
     */
    void start();

    /**
     * Stop dispatching and wait for in-flight runs up to the configured grace period. Idempotent.
     */
    void stop();

    /**
     * Evaluate the current minute once and start every due, enabled, idle job.
     *
     * @return ids of the jobs started by this tick
     */
    List<String> tick();

    /**
     * Run a job immediately on the caller's thread, honoring the one-run-per-job guard.
     *
     * @return the completed execution, or {@code null} if the job was already running
     */
    ExecutionRecord runNow(String jobId);

    void enable(String jobId);

    void disable(String jobId);

    List<JobStatus> status();

    List<ExecutionRecord> recentExecutions(String jobId, int limit);
}
