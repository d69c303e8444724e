package io.cronwarden.core;

import io.cronwarden.ScheduledJob;
import io.cronwarden.utils.ScheduleExpression;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable registration of a job: the job itself plus its parsed schedule and the
 * timeout / alert threshold resolved against scheduler defaults.
 */
public record JobDefinition(
        String id,
        String displayName,
        ScheduleExpression schedule,
        ScheduleKind scheduleKind,
        String scheduleSource,
        ScheduledJob job,
        Duration timeout,
        int alertThreshold,
        Map<String, Object> metadata
) {
    public JobDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
