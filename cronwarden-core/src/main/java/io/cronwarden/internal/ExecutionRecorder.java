package io.cronwarden.internal;

import io.cronwarden.alert.AlertSink;
import io.cronwarden.core.ExecutionRecord;
import io.cronwarden.core.ExecutionStatus;
import io.cronwarden.core.JobDefinition;
import io.cronwarden.store.ExecutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Persists execution records and maintains failure streaks.
 *
 * <p>Store failures are logged and swallowed here: a run that cannot be recorded still
 * completes, and the dispatcher keeps going.
 */
public class ExecutionRecorder {
    private static final Logger log = LoggerFactory.getLogger(ExecutionRecorder.class);

    static final int MAX_SUMMARY_LENGTH = 2000;

    private final ExecutionStore store;
    private final AlertSink alertSink;
    private final Clock clock;

    public ExecutionRecorder(ExecutionStore store, AlertSink alertSink, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ExecutionRecord start(JobDefinition job) {
        ExecutionRecord record = ExecutionRecord.started(job.id(), clock.instant());
        try {
            store.insertStarted(record);
        } catch (Exception e) {
            log.warn("cronwarden insertStarted failed jobId={} executionId={} msg={}", job.id(), record.id(), e.getMessage(), e);
        }
        return record;
    }

    public ExecutionRecord complete(JobDefinition job, ExecutionRecord started, ExecutionStatus status, String summary) {
        Instant completedAt = clock.instant();
        ExecutionRecord completed = started.complete(completedAt, status, truncate(summary));
        try {
            store.complete(completed);
        } catch (Exception e) {
            log.warn("cronwarden complete failed jobId={} executionId={} msg={}", job.id(), completed.id(), e.getMessage(), e);
        }
        updateStreak(job, completed);
        return completed;
    }

    private void updateStreak(JobDefinition job, ExecutionRecord completed) {
        if (completed.status() == ExecutionStatus.OK) {
            try {
                store.resetFailures(job.id(), completed.completedAt());
            } catch (Exception e) {
                log.warn("cronwarden resetFailures failed jobId={} msg={}", job.id(), e.getMessage(), e);
            }
            return;
        }

        int streak;
        try {
            streak = store.incrementFailures(job.id(), completed.completedAt());
        } catch (Exception e) {
            log.warn("cronwarden incrementFailures failed jobId={} msg={}", job.id(), e.getMessage(), e);
            return;
        }

        log.debug("Job failure streak jobId={} consecutiveFailures={} threshold={}", job.id(), streak, job.alertThreshold());
        // alert once when the streak crosses the threshold, not on every later failure
        if (streak == job.alertThreshold()) {
            try {
                alertSink.jobFailing(job, streak, completed);
            } catch (Exception e) {
                log.error("cronwarden alert delivery failed jobId={} msg={}", job.id(), e.getMessage(), e);
            }
        }
    }

    private static String truncate(String summary) {
        if (summary == null || summary.length() <= MAX_SUMMARY_LENGTH) {
            return summary;
        }
        return summary.substring(0, MAX_SUMMARY_LENGTH) + "...";
    }
}
