package io.cronwarden.remote;

import io.cronwarden.core.ScheduleKind;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a job that calls an external service on a schedule.
 * Interpreted by {@link RemoteActionJob}; most fleet jobs are just one of these.
 */
public record JobSpec(

        // identity
        String id,
        String name,

        // scheduling
        String schedule,
        ScheduleKind scheduleKind,
        boolean marketHoursOnly,
        boolean enabled,

        // remote call
        URI target,
        String method,
        Map<String, Object> params,
        Map<String, String> headers,
        List<String> requiredFields,

        // execution limits
        Duration timeout,
        int alertThreshold
) {
    public JobSpec {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        Objects.requireNonNull(target, "target must not be null for job " + id);
        if (schedule == null || schedule.isBlank()) {
            throw new IllegalArgumentException("schedule must not be blank for job " + id);
        }
        name = name == null || name.isBlank() ? id : name;
        scheduleKind = scheduleKind == null ? ScheduleKind.CRON : scheduleKind;
        method = method == null || method.isBlank() ? "POST" : method;
        params = params == null ? Map.of() : Map.copyOf(params);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }

    public static JobSpec cron(String id, String schedule, URI target) {
        return new JobSpec(id, id, schedule, ScheduleKind.CRON, false, true, target, "POST",
                Map.of(), Map.of(), List.of(), null, 0);
    }
}
