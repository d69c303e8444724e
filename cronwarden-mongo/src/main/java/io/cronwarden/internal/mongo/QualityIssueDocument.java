package io.cronwarden.internal.mongo;

import io.cronwarden.core.Issue;
import io.cronwarden.core.Severity;
import io.cronwarden.core.Tier;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One issue found by a tier run, flattened for querying by time and severity.
 */
@Document(collection = "data_quality_issues")
public class QualityIssueDocument {

    @Id
    private String id;

    private String runId;
    private int tier;
    private Instant detectedAt;

    private Severity severity;
    private String type;
    private String entity;
    private String field;
    private long count;
    private String description;

    public QualityIssueDocument() {
    }

    static QualityIssueDocument from(String runId, Tier tier, Issue issue, Instant detectedAt) {
        QualityIssueDocument doc = new QualityIssueDocument();
        doc.setRunId(runId);
        doc.setTier(tier.value());
        doc.setDetectedAt(detectedAt);
        doc.setSeverity(issue.severity());
        doc.setType(issue.type());
        doc.setEntity(issue.entity());
        doc.setField(issue.field());
        doc.setCount(issue.count());
        doc.setDescription(issue.description());
        return doc;
    }

    Issue toIssue() {
        return new Issue(severity, type, entity, field, count, description);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public int getTier() {
        return tier;
    }

    public void setTier(int tier) {
        this.tier = tier;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public void setDetectedAt(Instant detectedAt) {
        this.detectedAt = detectedAt;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getEntity() {
        return entity;
    }

    public void setEntity(String entity) {
        this.entity = entity;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public long getCount() {
        return count;
    }

    public void setCount(long count) {
        this.count = count;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
