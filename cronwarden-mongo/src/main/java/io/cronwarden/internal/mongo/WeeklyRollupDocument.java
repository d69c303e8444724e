package io.cronwarden.internal.mongo;

import io.cronwarden.core.Severity;
import io.cronwarden.core.WeeklyRollup;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weekly audit summary. Keyed by ISO week of the window end, e.g. {@code 2026-W10}, so a rerun
 * in the same week replaces it.
 */
@Document(collection = "data_quality_weekly_rollups")
public class WeeklyRollupDocument {

    @Id
    private String id;

    private Instant from;
    private Instant to;
    private int weekNumber;
    private int totalChecks;
    private int passed;
    private int warnings;
    private int failed;
    private int errors;
    private double passRate;
    private long totalIssues;
    private Map<String, Long> issuesByType;
    private Map<String, Long> issuesBySeverity;

    public WeeklyRollupDocument() {
    }

    static WeeklyRollupDocument from(WeeklyRollup rollup) {
        WeeklyRollupDocument doc = new WeeklyRollupDocument();
        doc.setId(weekKey(rollup.to()));
        doc.setFrom(rollup.from());
        doc.setTo(rollup.to());
        doc.setWeekNumber(rollup.weekNumber());
        doc.setTotalChecks(rollup.totalChecks());
        doc.setPassed(rollup.passed());
        doc.setWarnings(rollup.warnings());
        doc.setFailed(rollup.failed());
        doc.setErrors(rollup.errors());
        doc.setPassRate(rollup.passRate());
        doc.setTotalIssues(rollup.totalIssues());
        doc.setIssuesByType(new LinkedHashMap<>(rollup.issuesByType()));
        Map<String, Long> bySeverity = new LinkedHashMap<>();
        rollup.issuesBySeverity().forEach((severity, count) -> bySeverity.put(severity.name(), count));
        doc.setIssuesBySeverity(bySeverity);
        return doc;
    }

    static String weekKey(Instant instant) {
        int year = instant.atZone(ZoneOffset.UTC).get(IsoFields.WEEK_BASED_YEAR);
        int week = instant.atZone(ZoneOffset.UTC).get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        return String.format("%d-W%02d", year, week);
    }

    WeeklyRollup toRollup() {
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        if (issuesBySeverity != null) {
            issuesBySeverity.forEach((name, count) -> bySeverity.put(Severity.valueOf(name), count));
        }
        return new WeeklyRollup(from, to, weekNumber, totalChecks, passed, warnings, failed, errors, passRate,
                totalIssues, issuesByType == null ? Map.of() : issuesByType, bySeverity);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getFrom() {
        return from;
    }

    public void setFrom(Instant from) {
        this.from = from;
    }

    public Instant getTo() {
        return to;
    }

    public void setTo(Instant to) {
        this.to = to;
    }

    public int getWeekNumber() {
        return weekNumber;
    }

    public void setWeekNumber(int weekNumber) {
        this.weekNumber = weekNumber;
    }

    public int getTotalChecks() {
        return totalChecks;
    }

    public void setTotalChecks(int totalChecks) {
        this.totalChecks = totalChecks;
    }

    public int getPassed() {
        return passed;
    }

    public void setPassed(int passed) {
        this.passed = passed;
    }

    public int getWarnings() {
        return warnings;
    }

    public void setWarnings(int warnings) {
        this.warnings = warnings;
    }

    public int getFailed() {
        return failed;
    }

    public void setFailed(int failed) {
        this.failed = failed;
    }

    public int getErrors() {
        return errors;
    }

    public void setErrors(int errors) {
        this.errors = errors;
    }

    public double getPassRate() {
        return passRate;
    }

    public void setPassRate(double passRate) {
        this.passRate = passRate;
    }

    public long getTotalIssues() {
        return totalIssues;
    }

    public void setTotalIssues(long totalIssues) {
        this.totalIssues = totalIssues;
    }

    public Map<String, Long> getIssuesByType() {
        return issuesByType;
    }

    public void setIssuesByType(Map<String, Long> issuesByType) {
        this.issuesByType = issuesByType;
    }

    public Map<String, Long> getIssuesBySeverity() {
        return issuesBySeverity;
    }

    public void setIssuesBySeverity(Map<String, Long> issuesBySeverity) {
        this.issuesBySeverity = issuesBySeverity;
    }
}
