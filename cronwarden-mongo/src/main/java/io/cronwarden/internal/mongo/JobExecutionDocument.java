package io.cronwarden.internal.mongo;

import io.cronwarden.core.ExecutionRecord;
import io.cronwarden.core.ExecutionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Append-only execution history. One document per run.
 */
@Document(collection = "job_executions")
public class JobExecutionDocument {

    @Id
    private String id;

    private String jobId;
    private Instant startedAt;

    @Field(write = Field.Write.ALWAYS)
    private Instant completedAt;

    private ExecutionStatus status;
    private String resultSummary;
    private Long durationMs;

    public JobExecutionDocument() {
    }

    static JobExecutionDocument from(ExecutionRecord record) {
        JobExecutionDocument doc = new JobExecutionDocument();
        doc.setId(record.id());
        doc.setJobId(record.jobId());
        doc.setStartedAt(record.startedAt());
        doc.setCompletedAt(record.completedAt());
        doc.setStatus(record.status());
        doc.setResultSummary(record.resultSummary());
        doc.setDurationMs(record.durationMs());
        return doc;
    }

    ExecutionRecord toRecord() {
        return new ExecutionRecord(id, jobId, startedAt, completedAt, status, resultSummary, durationMs);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public String getResultSummary() {
        return resultSummary;
    }

    public void setResultSummary(String resultSummary) {
        this.resultSummary = resultSummary;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }
}
