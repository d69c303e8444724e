package io.cronwarden.quality;

import io.cronwarden.alert.AlertSink;
import io.cronwarden.alert.DigestNotifier;
import io.cronwarden.alert.DigestQueue;
import io.cronwarden.core.CheckStatus;
import io.cronwarden.core.Issue;
import io.cronwarden.core.QualityCheckResult;
import io.cronwarden.core.Severity;
import io.cronwarden.core.Tier;
import io.cronwarden.core.TierRunResult;
import io.cronwarden.core.WeeklyRollup;
import io.cronwarden.store.QualityResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Runs a tier's checks in order and routes their findings.
 *
 * <p>Every check runs regardless of earlier failures. Critical issues go to the
 * {@link AlertSink}; warnings and informational issues are queued for the daily digest.
 * The audit tier additionally computes a seven-day rollup.
 */
public class TieredCheckAggregator {
    private static final Logger log = LoggerFactory.getLogger(TieredCheckAggregator.class);

    static final Duration ROLLUP_WINDOW = Duration.ofDays(7);

    private final QualityResultStore store;
    private final AlertSink alertSink;
    private final DigestQueue digestQueue;
    private final DigestNotifier notifier;
    private final Clock clock;

    public TieredCheckAggregator(QualityResultStore store,
                                 AlertSink alertSink,
                                 DigestQueue digestQueue,
                                 DigestNotifier notifier,
                                 Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.alertSink = Objects.requireNonNull(alertSink, "alertSink must not be null");
        this.digestQueue = Objects.requireNonNull(digestQueue, "digestQueue must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public TierRunResult run(Tier tier, List<QualityCheck> checks) {
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(checks, "checks must not be null");

        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        log.info("Quality tier starting tier={} runId={} checks={}", tier, runId, checks.size());

        List<QualityCheckResult> results = new ArrayList<>(checks.size());
        List<Issue> allIssues = new ArrayList<>();
        for (QualityCheck check : checks) {
            QualityCheckResult result = runCheck(runId, tier, check);
            results.add(result);
            allIssues.addAll(result.issues());
            try {
                store.saveResult(result);
            } catch (Exception e) {
                log.warn("cronwarden saveResult failed checkId={} runId={} msg={}", check.id(), runId, e.getMessage(), e);
            }
        }

        Instant completedAt = clock.instant();
        if (!allIssues.isEmpty()) {
            try {
                store.saveIssues(runId, tier, allIssues, completedAt);
            } catch (Exception e) {
                log.warn("cronwarden saveIssues failed runId={} msg={}", runId, e.getMessage(), e);
            }
        }

        routeIssues(tier, runId, allIssues);

        WeeklyRollup rollup = null;
        if (tier == Tier.AUDIT) {
            rollup = rollUpWeek(completedAt);
        }

        CheckStatus overall = classify(allIssues);
        if (overall == CheckStatus.PASSED && results.stream().anyMatch(r -> r.status() == CheckStatus.ERROR)) {
            overall = CheckStatus.ERROR;
        }

        TierRunResult run = new TierRunResult(runId, tier, overall, results, allIssues, startedAt, completedAt, rollup);
        log.info("Quality tier completed {} durationMs={}", run.summary(), Duration.between(startedAt, completedAt).toMillis());
        return run;
    }

    /**
     * Classify a check's findings by their worst severity.
     */
    public static CheckStatus classify(List<Issue> issues) {
        if (issues.isEmpty()) {
            return CheckStatus.PASSED;
        }
        boolean critical = issues.stream().anyMatch(i -> i.severity() == Severity.CRITICAL);
        return critical ? CheckStatus.FAILED : CheckStatus.WARNING;
    }

    private QualityCheckResult runCheck(String runId, Tier tier, QualityCheck check) {
        Instant checkStart = clock.instant();
        try {
            List<Issue> issues = check.run();
            if (issues == null) {
                issues = List.of();
            }
            Instant checkEnd = clock.instant();
            log.debug("Quality check finished checkId={} issues={}", check.id(), issues.size());
            return new QualityCheckResult(runId, check.id(), tier, classify(issues), issues,
                    Duration.between(checkStart, checkEnd).toMillis(), null, checkStart, checkEnd);
        } catch (Exception e) {
            Instant checkEnd = clock.instant();
            log.error("Quality check error checkId={} tier={} msg={}", check.id(), tier, e.getMessage(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return new QualityCheckResult(runId, check.id(), tier, CheckStatus.ERROR, List.of(),
                    Duration.between(checkStart, checkEnd).toMillis(), message, checkStart, checkEnd);
        }
    }

    private void routeIssues(Tier tier, String runId, List<Issue> issues) {
        List<Issue> critical = new ArrayList<>();
        List<Issue> digest = new ArrayList<>();
        for (Issue issue : issues) {
            if (issue.severity() == Severity.CRITICAL) {
                critical.add(issue);
            } else {
                digest.add(issue);
            }
        }

        if (!critical.isEmpty()) {
            log.warn("Quality tier found critical issues tier={} runId={} count={}", tier, runId, critical.size());
            try {
                alertSink.criticalIssues(tier, runId, critical);
            } catch (Exception e) {
                log.error("cronwarden critical alert failed runId={} msg={}", runId, e.getMessage(), e);
            }
        }
        digestQueue.append(digest);
    }

    private WeeklyRollup rollUpWeek(Instant to) {
        Instant from = to.minus(ROLLUP_WINDOW);
        List<QualityCheckResult> results;
        List<Issue> issues;
        try {
            results = store.resultsSince(from);
            issues = store.issuesSince(from);
        } catch (Exception e) {
            log.warn("cronwarden weekly rollup query failed msg={}", e.getMessage(), e);
            return null;
        }

        WeeklyRollup rollup = computeRollup(from, to, results, issues);
        try {
            store.saveRollup(rollup);
        } catch (Exception e) {
            log.warn("cronwarden saveRollup failed week={} msg={}", rollup.weekNumber(), e.getMessage(), e);
        }
        try {
            notifier.deliverWeeklySummary(rollup);
        } catch (Exception e) {
            log.warn("cronwarden weekly summary delivery failed week={} msg={}", rollup.weekNumber(), e.getMessage(), e);
        }
        return rollup;
    }

    static WeeklyRollup computeRollup(Instant from, Instant to, List<QualityCheckResult> results, List<Issue> issues) {
        int passed = 0;
        int warnings = 0;
        int failed = 0;
        int errors = 0;
        for (QualityCheckResult r : results) {
            switch (r.status()) {
                case PASSED -> passed++;
                case WARNING -> warnings++;
                case FAILED -> failed++;
                case ERROR -> errors++;
            }
        }

        Map<String, Long> byType = new TreeMap<>();
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Issue issue : issues) {
            byType.merge(issue.type(), 1L, Long::sum);
            bySeverity.merge(issue.severity(), 1L, Long::sum);
        }

        int total = results.size();
        double passRate = total == 0 ? 100.0 : Math.round(passed * 1000.0 / total) / 10.0;
        int week = to.atZone(ZoneOffset.UTC).get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);

        return new WeeklyRollup(from, to, week, total, passed, warnings, failed, errors, passRate,
                issues.size(), byType, bySeverity);
    }
}
