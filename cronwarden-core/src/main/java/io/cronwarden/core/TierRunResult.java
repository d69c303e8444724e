package io.cronwarden.core;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate of one tier run.
 *
 * @param rollup weekly rollup, only computed for {@link Tier#AUDIT}
 */
public record TierRunResult(
        String runId,
        Tier tier,
        CheckStatus status,
        List<QualityCheckResult> checks,
        List<Issue> issues,
        Instant startedAt,
        Instant completedAt,
        WeeklyRollup rollup
) {
    public TierRunResult {
        checks = List.copyOf(checks);
        issues = List.copyOf(issues);
    }

    public long count(CheckStatus s) {
        return checks.stream().filter(c -> c.status() == s).count();
    }

    public long count(Severity s) {
        return issues.stream().filter(i -> i.severity() == s).count();
    }

    public String summary() {
        return String.format("tier=%s status=%s checks=%d passed=%d warning=%d failed=%d error=%d issues=%d critical=%d",
                tier, status, checks.size(),
                count(CheckStatus.PASSED), count(CheckStatus.WARNING), count(CheckStatus.FAILED), count(CheckStatus.ERROR),
                issues.size(), count(Severity.CRITICAL));
    }
}
