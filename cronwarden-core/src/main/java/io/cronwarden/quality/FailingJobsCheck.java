package io.cronwarden.quality;

import io.cronwarden.core.FailureStreak;
import io.cronwarden.core.Issue;
import io.cronwarden.core.JobDefinition;
import io.cronwarden.core.JobRegistry;
import io.cronwarden.core.Severity;
import io.cronwarden.store.ExecutionStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Flags registered jobs that keep failing or have not succeeded recently.
 * Three consecutive failures raise a warning, five a critical issue.
 */
public class FailingJobsCheck implements QualityCheck {

    public static final String ID = "freshness-scheduled-jobs";

    static final int WARNING_STREAK = 3;
    static final int CRITICAL_STREAK = 5;

    private final Supplier<? extends Collection<JobDefinition>> jobs;
    private final ExecutionStore store;
    private final Clock clock;
    private final Duration staleAfter;

    public FailingJobsCheck(JobRegistry registry, ExecutionStore store, Clock clock, Duration staleAfter) {
        this(Objects.requireNonNull(registry, "registry must not be null")::all, store, clock, staleAfter);
    }

    /**
     * @param jobs resolved on every run, so the check can be built before the registry that will contain it
     */
    public FailingJobsCheck(Supplier<? extends Collection<JobDefinition>> jobs,
                            ExecutionStore store,
                            Clock clock,
                            Duration staleAfter) {
        this.jobs = Objects.requireNonNull(jobs, "jobs must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.staleAfter = Objects.requireNonNull(staleAfter, "staleAfter must not be null");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Issue> run() {
        Instant staleBefore = clock.instant().minus(staleAfter);
        List<Issue> issues = new ArrayList<>();
        for (JobDefinition def : jobs.get()) {
            FailureStreak streak = store.failureStreak(def.id()).orElse(null);
            if (streak == null) {
                continue;
            }
            int failures = streak.consecutiveFailures();
            boolean stale = streak.lastRunAt() != null
                    && (streak.lastSuccessfulRun() == null || streak.lastSuccessfulRun().isBefore(staleBefore));
            if (failures < WARNING_STREAK && !stale) {
                continue;
            }
            Severity severity = failures >= CRITICAL_STREAK ? Severity.CRITICAL : Severity.WARNING;
            issues.add(new Issue(severity, "stale_job", "scheduled_jobs", def.id(), 1,
                    "Job '" + def.displayName() + "' is stale (failures: " + failures + ")"));
        }
        return issues;
    }
}
