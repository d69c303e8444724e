package io.cronwarden;

import io.cronwarden.core.ScheduleKind;

import java.time.Duration;
import java.util.Map;

/**
 * A unit of scheduled work.
 *
 * <p>Implementations are registered once at startup and invoked by the scheduler whenever
 * {@link #schedule()} matches the current minute. A run either returns a {@link JobResult}
 * or throws; both are recorded as one execution.
 */
public interface ScheduledJob {

    /**
     * Stable identifier, unique across the registry.
     */
    String id();

    default String displayName() {
        return id();
    }

    /**
     * Five-field cron expression, or an interval such as {@code "300"} / {@code "5 minutes"}
     * when {@link #scheduleKind()} is {@link ScheduleKind#INTERVAL}.
     */
    String schedule();

    default ScheduleKind scheduleKind() {
        return ScheduleKind.CRON;
    }

    JobResult run() throws Exception;

    default Map<String, Object> metadata() {
        return Map.of();
    }

    /**
     * Per-job execution timeout; {@code null} falls back to the scheduler default.
     */
    default Duration timeout() {
        return null;
    }

    /**
     * Consecutive failures that raise an escalation; {@code 0} falls back to the scheduler default.
     */
    default int alertThreshold() {
        return 0;
    }

    default boolean enabledAtStartup() {
        return true;
    }
}
