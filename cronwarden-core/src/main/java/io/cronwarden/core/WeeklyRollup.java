package io.cronwarden.core;

import java.time.Instant;
import java.util.Map;

/**
 * Seven-day summary computed by the audit tier.
 *
 * @param passRate percentage of passed checks, one decimal; 100.0 when no checks ran
 */
public record WeeklyRollup(
        Instant from,
        Instant to,
        int weekNumber,
        int totalChecks,
        int passed,
        int warnings,
        int failed,
        int errors,
        double passRate,
        long totalIssues,
        Map<String, Long> issuesByType,
        Map<Severity, Long> issuesBySeverity
) {
    public WeeklyRollup {
        issuesByType = Map.copyOf(issuesByType);
        issuesBySeverity = Map.copyOf(issuesBySeverity);
    }
}
