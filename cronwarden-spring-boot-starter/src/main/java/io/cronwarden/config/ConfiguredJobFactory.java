package io.cronwarden.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronwarden.ScheduledJob;
import io.cronwarden.alert.DigestFlushJob;
import io.cronwarden.alert.DigestNotifier;
import io.cronwarden.alert.DigestQueue;
import io.cronwarden.core.JobDefinition;
import io.cronwarden.core.Tier;
import io.cronwarden.quality.FailingJobsCheck;
import io.cronwarden.quality.QualityAuditJob;
import io.cronwarden.quality.QualityCheck;
import io.cronwarden.quality.TieredCheckAggregator;
import io.cronwarden.remote.ActionInvoker;
import io.cronwarden.remote.InvokeRequest;
import io.cronwarden.remote.JobSpec;
import io.cronwarden.remote.RemoteActionJob;
import io.cronwarden.remote.RemoteQualityCheck;
import io.cronwarden.remote.RemoteThresholdAction;
import io.cronwarden.store.ExecutionStore;
import io.cronwarden.store.ThresholdBaselineStore;
import io.cronwarden.trigger.MarketSessionGate;
import io.cronwarden.trigger.ThresholdTriggerJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Turns the {@code cronwarden.*} job sections into {@link ScheduledJob} instances:
 * remote action jobs, quality tiers, threshold triggers and the digest flush job.
 */
public class ConfiguredJobFactory {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredJobFactory.class);

    private final CronwardenProperties props;
    private final ActionInvoker invoker;
    private final ObjectMapper objectMapper;
    private final MarketSessionGate gate;
    private final Clock clock;
    private final TieredCheckAggregator aggregator;
    private final ExecutionStore executionStore;
    private final ThresholdBaselineStore baselineStore;
    private final DigestQueue digestQueue;
    private final DigestNotifier digestNotifier;

    public ConfiguredJobFactory(CronwardenProperties props,
                                ActionInvoker invoker,
                                ObjectMapper objectMapper,
                                MarketSessionGate gate,
                                Clock clock,
                                TieredCheckAggregator aggregator,
                                ExecutionStore executionStore,
                                ThresholdBaselineStore baselineStore,
                                DigestQueue digestQueue,
                                DigestNotifier digestNotifier) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.executionStore = Objects.requireNonNull(executionStore, "executionStore must not be null");
        this.baselineStore = Objects.requireNonNull(baselineStore, "baselineStore must not be null");
        this.digestQueue = Objects.requireNonNull(digestQueue, "digestQueue must not be null");
        this.digestNotifier = Objects.requireNonNull(digestNotifier, "digestNotifier must not be null");
    }

    /**
     * @param registeredJobs view of the final registry, used by the job health check of the fast tier
     */
    public List<ScheduledJob> build(Supplier<? extends Collection<JobDefinition>> registeredJobs) {
        List<ScheduledJob> jobs = new ArrayList<>();
        List<ScheduledJob> remote = remoteJobs();
        List<ScheduledJob> tiers = qualityTiers(registeredJobs);
        List<ScheduledJob> triggers = thresholdTriggers();
        jobs.addAll(remote);
        jobs.addAll(tiers);
        jobs.addAll(triggers);
        if (props.getDigest().isEnabled()) {
            jobs.add(new DigestFlushJob(digestQueue, digestNotifier, props.getDigest().getSchedule()));
        }
        log.info("Configured jobs remote={} qualityTiers={} thresholdTriggers={} digest={}",
                remote.size(), tiers.size(), triggers.size(), props.getDigest().isEnabled());
        return jobs;
    }

    List<ScheduledJob> remoteJobs() {
        List<ScheduledJob> jobs = new ArrayList<>();
        for (CronwardenProperties.Job job : props.getJobs()) {
            JobSpec spec = new JobSpec(
                    job.getId(),
                    job.getName(),
                    job.getSchedule(),
                    job.getScheduleKind(),
                    job.isMarketHoursOnly(),
                    job.isEnabled(),
                    job.getTarget(),
                    job.getMethod(),
                    job.getParams(),
                    job.getHeaders(),
                    job.getRequiredFields(),
                    job.getTimeout(),
                    job.getAlertThreshold()
            );
            jobs.add(RemoteActionJob.from(spec, invoker, objectMapper, gate, clock));
        }
        return jobs;
    }

    List<ScheduledJob> qualityTiers(Supplier<? extends Collection<JobDefinition>> registeredJobs) {
        CronwardenProperties.Quality quality = props.getQuality();
        List<ScheduledJob> jobs = new ArrayList<>();
        for (Tier tier : Tier.values()) {
            CronwardenProperties.TierConfig config = tierConfig(tier);
            if (!config.isEnabled()) {
                continue;
            }
            List<QualityCheck> checks = new ArrayList<>();
            for (CronwardenProperties.Check check : config.getChecks()) {
                if (isBlank(check.getId())) {
                    throw new IllegalArgumentException("Quality check id must not be blank in tier " + tier);
                }
                Objects.requireNonNull(check.getTarget(), "target must not be null for quality check " + check.getId());
                InvokeRequest request = new InvokeRequest(check.getTarget(), check.getMethod(), null,
                        check.getHeaders(), check.getTimeout(), null);
                checks.add(new RemoteQualityCheck(check.getId(), request, invoker));
            }
            if (tier == Tier.FAST && quality.isJobHealthCheck()) {
                checks.add(new FailingJobsCheck(registeredJobs, executionStore, clock, quality.getStaleAfter()));
            }
            if (checks.isEmpty()) {
                log.warn("Quality tier enabled without checks, skipping tier={}", tier);
                continue;
            }
            jobs.add(new QualityAuditJob(
                    isBlank(config.getId()) ? QualityAuditJob.defaultId(tier) : config.getId(),
                    isBlank(config.getName()) ? QualityAuditJob.defaultName(tier) : config.getName(),
                    isBlank(config.getSchedule()) ? tier.defaultSchedule() : config.getSchedule(),
                    tier,
                    checks,
                    aggregator,
                    config.getTimeout()
            ));
        }
        return jobs;
    }

    List<ScheduledJob> thresholdTriggers() {
        List<ScheduledJob> jobs = new ArrayList<>();
        for (CronwardenProperties.ThresholdTrigger trigger : props.getThresholdTriggers()) {
            if (isBlank(trigger.getId())) {
                throw new IllegalArgumentException("Threshold trigger id must not be blank");
            }
            RemoteThresholdAction action = new RemoteThresholdAction(
                    Objects.requireNonNull(trigger.getTarget(), "target must not be null for trigger " + trigger.getId()),
                    trigger.getParams(),
                    trigger.getHeaders(),
                    trigger.getTimeout(),
                    invoker,
                    objectMapper
            );
            jobs.add(new ThresholdTriggerJob(
                    trigger.getId(),
                    trigger.getName(),
                    trigger.getSchedule(),
                    trigger.getThreshold(),
                    action,
                    baselineStore,
                    clock,
                    trigger.getTimeout()
            ));
        }
        return jobs;
    }

    private CronwardenProperties.TierConfig tierConfig(Tier tier) {
        CronwardenProperties.Tiers tiers = props.getQuality().getTiers();
        switch (tier) {
            case FAST:
                return tiers.getFast();
            case DEEP:
                return tiers.getDeep();
            default:
                return tiers.getAudit();
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
