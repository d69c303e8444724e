package io.cronwarden.internal.mongo;

import io.cronwarden.core.Issue;
import io.cronwarden.core.Severity;

/**
 * Embedded form of an {@link Issue}.
 */
public class IssueEntry {

    private Severity severity;
    private String type;
    private String entity;
    private String field;
    private long count;
    private String description;

    public IssueEntry() {
    }

    static IssueEntry from(Issue issue) {
        IssueEntry entry = new IssueEntry();
        entry.setSeverity(issue.severity());
        entry.setType(issue.type());
        entry.setEntity(issue.entity());
        entry.setField(issue.field());
        entry.setCount(issue.count());
        entry.setDescription(issue.description());
        return entry;
    }

    Issue toIssue() {
        return new Issue(severity, type, entity, field, count, description);
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
