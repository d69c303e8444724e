package io.cronwarden.core;

import io.cronwarden.ScheduledJob;
import io.cronwarden.utils.IntervalParser;
import io.cronwarden.utils.ScheduleExpression;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registered jobs by id, in registration order. Built once at startup; an invalid or
 * duplicate registration fails the whole build.
 */
public class JobRegistry {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
    public static final int DEFAULT_ALERT_THRESHOLD = 3;

    private final Map<String, JobDefinition> definitionsById;

    public JobRegistry(List<? extends ScheduledJob> jobs) {
        this(jobs, DEFAULT_TIMEOUT, DEFAULT_ALERT_THRESHOLD);
    }

    public JobRegistry(List<? extends ScheduledJob> jobs, Duration defaultTimeout, int defaultAlertThreshold) {
        Objects.requireNonNull(jobs, "jobs must not be null");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be a positive duration");
        }
        if (defaultAlertThreshold <= 0) {
            throw new IllegalArgumentException("defaultAlertThreshold must be positive");
        }

        Map<String, JobDefinition> byId = new LinkedHashMap<>();
        for (ScheduledJob job : jobs) {
            JobDefinition def = define(job, defaultTimeout, defaultAlertThreshold);
            if (byId.putIfAbsent(def.id(), def) != null) {
                throw new IllegalStateException("Duplicate job id: " + def.id());
            }
        }
        this.definitionsById = Collections.unmodifiableMap(byId);
    }

    private static JobDefinition define(ScheduledJob job, Duration defaultTimeout, int defaultAlertThreshold) {
        Objects.requireNonNull(job, "job must not be null");
        String id = job.id();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Job id must not be blank: " + job.getClass().getName());
        }

        ScheduleKind kind = job.scheduleKind() == null ? ScheduleKind.CRON : job.scheduleKind();
        String source = job.schedule();
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Job " + id + " has no schedule");
        }

        ScheduleExpression expression;
        try {
            expression = ScheduleExpression.parse(kind == ScheduleKind.INTERVAL ? IntervalParser.toCron(source) : source);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Job " + id + " has an invalid schedule '" + source + "': " + e.getMessage(), e);
        }

        Duration timeout = job.timeout();
        if (timeout == null) {
            timeout = defaultTimeout;
        } else if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Job " + id + " timeout must be a positive duration");
        }

        int threshold = job.alertThreshold() > 0 ? job.alertThreshold() : defaultAlertThreshold;
        String displayName = job.displayName() == null || job.displayName().isBlank() ? id : job.displayName();

        return new JobDefinition(id, displayName, expression, kind, source, job, timeout, threshold, job.metadata());
    }

    public JobDefinition getRequired(String id) {
        JobDefinition def = definitionsById.get(id);
        if (def == null) {
            throw new IllegalArgumentException("No job registered for id: " + id);
        }
        return def;
    }

    public Optional<JobDefinition> find(String id) {
        return Optional.ofNullable(definitionsById.get(id));
    }

    public Collection<JobDefinition> all() {
        return definitionsById.values();
    }

    public int size() {
        return definitionsById.size();
    }
}
