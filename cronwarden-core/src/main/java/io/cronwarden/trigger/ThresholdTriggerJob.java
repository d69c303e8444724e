package io.cronwarden.trigger;

import io.cronwarden.JobResult;
import io.cronwarden.ScheduledJob;
import io.cronwarden.core.ThresholdBaseline;
import io.cronwarden.core.ThresholdOutcome;
import io.cronwarden.core.TriggerAction;
import io.cronwarden.store.ThresholdBaselineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Fires an action once enough changes have accumulated since the last trigger, then resets
 * the change counter.
 *
 * <p>Before firing, the trigger marks the stored baseline as pending reset. If the action
 * succeeds but the reset fails, the pass reports {@link TriggerAction#TRIGGERED_WITH_RESET_ERROR}
 * and the next pass, in this process or after a restart, retries only the reset. The action is
 * never fired a second time for the same accumulation.
 */
public class ThresholdTriggerJob implements ScheduledJob {
    private static final Logger log = LoggerFactory.getLogger(ThresholdTriggerJob.class);

    /**
     * The work performed when the threshold is reached.
     */
    @FunctionalInterface
    public interface Action {
        JobResult fire(ThresholdBaseline baseline) throws Exception;
    }

    private final String id;
    private final String displayName;
    private final String schedule;
    private final long threshold;
    private final Action action;
    private final ThresholdBaselineStore store;
    private final Clock clock;
    private final Duration timeout;

    public ThresholdTriggerJob(String id,
                               String displayName,
                               String schedule,
                               long threshold,
                               Action action,
                               ThresholdBaselineStore store,
                               Clock clock,
                               Duration timeout) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.displayName = displayName;
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        this.threshold = threshold;
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.timeout = timeout;
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
        return Map.of("threshold", threshold);
    }

    public long threshold() {
        return threshold;
    }

    @Override
    public JobResult run() {
        ThresholdOutcome outcome = evaluate(false);
        return toResult(outcome);
    }

    /**
     * Fire the action regardless of the current count, then reset the counter.
     */
    public ThresholdOutcome forceTrigger() {
        return evaluate(true);
    }

    /**
     * Whether the stored baseline carries a firing whose counter reset has not landed yet.
     */
    public boolean hasPendingReset() {
        return store.find(id).map(ThresholdBaseline::resetPending).orElse(false);
    }

    private synchronized ThresholdOutcome evaluate(boolean force) {
        ThresholdBaseline baseline = store.ensure(id, threshold);

        if (baseline.resetPending()) {
            Instant pendingAt = baseline.pendingResetAt();
            try {
                store.reset(id, pendingAt);
                log.info("Threshold trigger reset reconciled jobId={} triggeredAt={}", id, pendingAt);
            } catch (Exception e) {
                log.error("Threshold trigger reset still failing jobId={} triggeredAt={} msg={}",
                        id, pendingAt, e.getMessage(), e);
                return new ThresholdOutcome(TriggerAction.RESET_PENDING, -1, threshold, e.getMessage());
            }
            baseline = new ThresholdBaseline(id, pendingAt, 0, threshold, null);
        }

        long count = baseline.currentCount();
        if (!force && count < threshold) {
            log.debug("Threshold not reached jobId={} count={} threshold={}", id, count, threshold);
            return new ThresholdOutcome(TriggerAction.SKIPPED, count, threshold, null);
        }

        // claim the firing first so a restart after a lost reset cannot fire the same accumulation again
        Instant triggeredAt = clock.instant();
        try {
            store.markTriggered(id, triggeredAt);
        } catch (Exception e) {
            log.error("Threshold trigger could not claim firing jobId={} msg={}", id, e.getMessage(), e);
            return new ThresholdOutcome(TriggerAction.FAILED, count, threshold, e.getMessage());
        }

        log.info("Threshold trigger firing jobId={} count={} threshold={} force={}", id, count, threshold, force);
        JobResult fired;
        try {
            fired = action.fire(baseline);
        } catch (Exception e) {
            log.error("Threshold trigger action failed jobId={} msg={}", id, e.getMessage(), e);
            releaseClaim();
            return new ThresholdOutcome(TriggerAction.FAILED, count, threshold, e.getMessage());
        }
        if (fired == null || !fired.success()) {
            String reason = fired == null ? "no result" : fired.summary();
            log.warn("Threshold trigger action unsuccessful jobId={} reason={}", id, reason);
            releaseClaim();
            return new ThresholdOutcome(TriggerAction.FAILED, count, threshold, reason);
        }

        try {
            store.reset(id, triggeredAt);
        } catch (Exception e) {
            log.error("Threshold trigger fired but reset failed jobId={} msg={}", id, e.getMessage(), e);
            return new ThresholdOutcome(TriggerAction.TRIGGERED_WITH_RESET_ERROR, count, threshold, e.getMessage());
        }
        return new ThresholdOutcome(TriggerAction.TRIGGERED, count, threshold, fired.summary());
    }

    private void releaseClaim() {
        try {
            store.clearPendingReset(id);
        } catch (Exception e) {
            // the next pass will reset the counter without firing
            log.error("Threshold trigger could not release claim jobId={} msg={}", id, e.getMessage(), e);
        }
    }

    private static JobResult toResult(ThresholdOutcome outcome) {
        return switch (outcome.action()) {
            case TRIGGERED, TRIGGERED_WITH_RESET_ERROR, SKIPPED -> JobResult.ok(outcome.summary(), outcome);
            case RESET_PENDING, FAILED -> JobResult.failed(outcome.summary(), outcome);
        };
    }
}
