package io.cronwarden.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of one quality check within one tier run.
 *
 * @param errorMessage set only when {@code status} is {@link CheckStatus#ERROR}
 */
public record QualityCheckResult(
        String runId,
        String checkId,
        Tier tier,
        CheckStatus status,
        List<Issue> issues,
        long durationMs,
        String errorMessage,
        Instant startedAt,
        Instant completedAt
) {
    public QualityCheckResult {
        Objects.requireNonNull(checkId, "checkId must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(status, "status must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public int issueCount() {
        return issues.size();
    }
}
