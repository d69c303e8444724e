package io.cronwarden.internal.mongo;

import io.cronwarden.core.CheckStatus;
import io.cronwarden.core.QualityCheckResult;
import io.cronwarden.core.Tier;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * One check result of one tier run. Only the first {@link #MAX_EMBEDDED_ISSUES} issues are embedded;
 * the full list lives in {@code data_quality_issues}.
 */
@Document(collection = "data_quality_results")
public class QualityResultDocument {

    static final int MAX_EMBEDDED_ISSUES = 50;

    @Id
    private String id;

    private String runId;
    private String checkId;
    private int tier;
    private CheckStatus status;
    private int issueCount;
    private List<IssueEntry> issues;
    private long durationMs;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;

    public QualityResultDocument() {
    }

    static QualityResultDocument from(QualityCheckResult result) {
        QualityResultDocument doc = new QualityResultDocument();
        doc.setRunId(result.runId());
        doc.setCheckId(result.checkId());
        doc.setTier(result.tier().value());
        doc.setStatus(result.status());
        doc.setIssueCount(result.issueCount());
        doc.setIssues(result.issues().stream()
                .limit(MAX_EMBEDDED_ISSUES)
                .map(IssueEntry::from)
                .toList());
        doc.setDurationMs(result.durationMs());
        doc.setErrorMessage(result.errorMessage());
        doc.setStartedAt(result.startedAt());
        doc.setCompletedAt(result.completedAt());
        return doc;
    }

    QualityCheckResult toResult() {
        return new QualityCheckResult(
                runId,
                checkId,
                Tier.of(tier),
                status,
                issues == null ? List.of() : issues.stream().map(IssueEntry::toIssue).toList(),
                durationMs,
                errorMessage,
                startedAt,
                completedAt
        );
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

    public String getCheckId() {
        return checkId;
    }

    public void setCheckId(String checkId) {
        this.checkId = checkId;
    }

    public int getTier() {
        return tier;
    }

    public void setTier(int tier) {
        this.tier = tier;
    }

    public CheckStatus getStatus() {
        return status;
    }

    public void setStatus(CheckStatus status) {
        this.status = status;
    }

    public int getIssueCount() {
        return issueCount;
    }

    public void setIssueCount(int issueCount) {
        this.issueCount = issueCount;
    }

    public List<IssueEntry> getIssues() {
        return issues;
    }

    public void setIssues(List<IssueEntry> issues) {
        this.issues = issues;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
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
}
