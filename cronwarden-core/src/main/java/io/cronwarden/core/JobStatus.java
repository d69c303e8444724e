package io.cronwarden.core;

import java.time.Instant;

public record JobStatus(
        String id,
        String displayName,
        String schedule,
        ScheduleKind scheduleKind,
        boolean enabled,
        boolean running,
        int consecutiveFailures,
        Instant lastRunAt,
        Instant lastSuccessfulRun,
        Instant nextRunAt
) {
}
