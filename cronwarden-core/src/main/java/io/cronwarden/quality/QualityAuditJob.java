package io.cronwarden.quality;

import io.cronwarden.JobResult;
import io.cronwarden.ScheduledJob;
import io.cronwarden.core.CheckStatus;
import io.cronwarden.core.Tier;
import io.cronwarden.core.TierRunResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scheduled job that runs one quality tier. The job succeeds even when checks find issues;
 * it fails only if every check errored.
 */
public class QualityAuditJob implements ScheduledJob {

    private final String id;
    private final String displayName;
    private final String schedule;
    private final Tier tier;
    private final List<QualityCheck> checks;
    private final TieredCheckAggregator aggregator;
    private final Duration timeout;

    public QualityAuditJob(Tier tier, List<QualityCheck> checks, TieredCheckAggregator aggregator) {
        this(defaultId(tier), defaultName(tier), tier.defaultSchedule(), tier, checks, aggregator, null);
    }

    public QualityAuditJob(String id,
                           String displayName,
                           String schedule,
                           Tier tier,
                           List<QualityCheck> checks,
                           TieredCheckAggregator aggregator,
                           Duration timeout) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.displayName = displayName;
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
        this.tier = Objects.requireNonNull(tier, "tier must not be null");
        this.checks = List.copyOf(Objects.requireNonNull(checks, "checks must not be null"));
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.timeout = timeout;
    }

    public static String defaultId(Tier tier) {
        return "data-quality-tier" + tier.value();
    }

    public static String defaultName(Tier tier) {
        return switch (tier) {
            case FAST -> "Data Quality - Hourly Checks";
            case DEEP -> "Data Quality - Daily Validation";
            case AUDIT -> "Data Quality - Weekly Audit";
        };
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public String schedule() {
        return schedule;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public Map<String, Object> metadata() {
        return Map.of("tier", tier.value(), "checks", checks.stream().map(QualityCheck::id).toList());
    }

    public Tier tier() {
        return tier;
    }

    @Override
    public JobResult run() {
        TierRunResult result = aggregator.run(tier, checks);
        if (!checks.isEmpty() && result.count(CheckStatus.ERROR) == checks.size()) {
            return JobResult.failed("all checks errored: " + result.summary(), result);
        }
        return JobResult.ok(result.summary(), result);
    }
}
