package io.cronwarden.internal.mongo;

import io.cronwarden.core.FailureStreak;
import io.cronwarden.core.ScheduleKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Current-value state of one registered job, keyed by job id.
 */
@Document(collection = "scheduled_jobs")
public class JobStateDocument {

    @Id
    private String id;

    private String displayName;
    private String schedule;
    private String cron;
    private ScheduleKind scheduleKind;
    private Map<String, Object> metadata;

    private Instant lastRunAt;
    private Instant lastSuccessfulRun;
    private int consecutiveFailures;

    public JobStateDocument() {
    }

    public FailureStreak toStreak() {
        return new FailureStreak(id, consecutiveFailures, lastRunAt, lastSuccessfulRun);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getSchedule() {
        return schedule;
    }

    public void setSchedule(String schedule) {
        this.schedule = schedule;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public ScheduleKind getScheduleKind() {
        return scheduleKind;
    }

    public void setScheduleKind(ScheduleKind scheduleKind) {
        this.scheduleKind = scheduleKind;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public Instant getLastSuccessfulRun() {
        return lastSuccessfulRun;
    }

    public void setLastSuccessfulRun(Instant lastSuccessfulRun) {
        this.lastSuccessfulRun = lastSuccessfulRun;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }
}
