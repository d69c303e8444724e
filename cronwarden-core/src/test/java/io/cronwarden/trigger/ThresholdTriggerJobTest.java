package io.cronwarden.trigger;

import io.cronwarden.JobResult;
import io.cronwarden.MutableClock;
import io.cronwarden.core.ThresholdBaseline;
import io.cronwarden.core.ThresholdOutcome;
import io.cronwarden.core.TriggerAction;
import io.cronwarden.internal.memory.InMemoryThresholdBaselineStore;
import io.cronwarden.store.ThresholdBaselineStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ThresholdTriggerJobTest {

    private static final String JOB_ID = "batch-retraining";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
    private final AtomicInteger fired = new AtomicInteger();
    private final ThresholdTriggerJob.Action action = baseline -> {
        fired.incrementAndGet();
        return JobResult.ok("training started");
    };

    private ThresholdTriggerJob job(ThresholdBaselineStore store) {
        return new ThresholdTriggerJob(JOB_ID, "Batch Retraining", "0 * * * *", 500, action, store, clock, null);
    }

    @Test
    void firesOnceAtThresholdAndResets() {
        InMemoryThresholdBaselineStore store = new InMemoryThresholdBaselineStore();
        store.recordChanges(JOB_ID, 500);
        ThresholdTriggerJob job = job(store);

        JobResult result = job.run();

        assertThat(result.success()).isTrue();
        assertThat(((ThresholdOutcome) result.value()).action()).isEqualTo(TriggerAction.TRIGGERED);
        assertThat(fired.get()).isEqualTo(1);
        ThresholdBaseline after = store.find(JOB_ID).orElseThrow();
        assertThat(after.currentCount()).isZero();
        assertThat(after.lastTriggerAt()).isEqualTo(clock.instant());

        JobResult second = job.run();
        assertThat(((ThresholdOutcome) second.value()).action()).isEqualTo(TriggerAction.SKIPPED);
        assertThat(fired.get()).isEqualTo(1);
    }

    @Test
    void belowThresholdIsNoOp() {
        InMemoryThresholdBaselineStore store = new InMemoryThresholdBaselineStore();
        store.recordChanges(JOB_ID, 499);

        JobResult result = job(store).run();

        assertThat(result.success()).isTrue();
        assertThat(((ThresholdOutcome) result.value()).action()).isEqualTo(TriggerAction.SKIPPED);
        assertThat(fired.get()).isZero();
        ThresholdBaseline after = store.find(JOB_ID).orElseThrow();
        assertThat(after.currentCount()).isEqualTo(499);
        assertThat(after.lastTriggerAt()).isNull();
    }

    @Test
    void missingBaselineCountsAsZero() {
        InMemoryThresholdBaselineStore store = new InMemoryThresholdBaselineStore();

        JobResult result = job(store).run();

        assertThat(((ThresholdOutcome) result.value()).action()).isEqualTo(TriggerAction.SKIPPED);
        assertThat(fired.get()).isZero();
        ThresholdBaseline created = store.find(JOB_ID).orElseThrow();
        assertThat(created.threshold()).isEqualTo(500);
        assertThat(created.currentCount()).isZero();
    }

    @Test
    void storedThresholdFollowsConfiguredThreshold() {
        InMemoryThresholdBaselineStore store = new InMemoryThresholdBaselineStore();
        store.recordChanges(JOB_ID, 10);
        assertThat(store.find(JOB_ID).orElseThrow().threshold()).isZero();

        job(store).run();

        ThresholdBaseline after = store.find(JOB_ID).orElseThrow();
        assertThat(after.threshold()).isEqualTo(500);
        assertThat(after.currentCount()).isEqualTo(10);
    }

    @Test
    void failedActionLeavesBaselineUntouched() {
        InMemoryThresholdBaselineStore store = new InMemoryThresholdBaselineStore();
        store.recordChanges(JOB_ID, 600);
        ThresholdTriggerJob job = new ThresholdTriggerJob(JOB_ID, null, "0 * * * *", 500,
                baseline -> JobResult.failed("http_error status=500"), store, clock, null);

        JobResult result = job.run();

        assertThat(result.success()).isFalse();
        assertThat(((ThresholdOutcome) result.value()).action()).isEqualTo(TriggerAction.FAILED);
        assertThat(store.find(JOB_ID).orElseThrow().currentCount()).isEqualTo(600);
        assertThat(job.hasPendingReset()).isFalse();
    }

    @Test
    void resetFailureIsReconciledWithoutFiringAgain() {
        FailingResetStore store = new FailingResetStore(2);
        store.recordChanges(JOB_ID, 700);
        ThresholdTriggerJob job = job(store);

        JobResult first = job.run();
        assertThat(first.success()).isTrue();
        assertThat(((ThresholdOutcome) first.value()).action()).isEqualTo(TriggerAction.TRIGGERED_WITH_RESET_ERROR);
        assertThat(job.hasPendingReset()).isTrue();

        JobResult second = job.run();
        assertThat(second.success()).isFalse();
        assertThat(((ThresholdOutcome) second.value()).action()).isEqualTo(TriggerAction.RESET_PENDING);

        JobResult third = job.run();
        assertThat(((ThresholdOutcome) third.value()).action()).isEqualTo(TriggerAction.SKIPPED);
        assertThat(job.hasPendingReset()).isFalse();
        assertThat(store.find(JOB_ID).orElseThrow().currentCount()).isZero();
        assertThat(fired.get()).isEqualTo(1);
    }

    @Test
    void restartAfterLostResetDoesNotFireAgain() {
        FailingResetStore store = new FailingResetStore(1);
        store.recordChanges(JOB_ID, 500);

        JobResult first = job(store).run();
        assertThat(((ThresholdOutcome) first.value()).action()).isEqualTo(TriggerAction.TRIGGERED_WITH_RESET_ERROR);

        clock.advance(Duration.ofHours(1));
        ThresholdTriggerJob restarted = job(store);
        JobResult second = restarted.run();

        assertThat(((ThresholdOutcome) second.value()).action()).isEqualTo(TriggerAction.SKIPPED);
        assertThat(fired.get()).isEqualTo(1);
        ThresholdBaseline after = store.find(JOB_ID).orElseThrow();
        assertThat(after.currentCount()).isZero();
        assertThat(after.lastTriggerAt()).isEqualTo(Instant.parse("2026-01-05T10:00:00Z"));
        assertThat(after.resetPending()).isFalse();
    }

    @Test
    void unreachableStoreBlocksFiring() {
        ThresholdBaselineStore store = mock(ThresholdBaselineStore.class);
        when(store.ensure(JOB_ID, 500)).thenReturn(new ThresholdBaseline(JOB_ID, null, 900, 500, null));
        doThrow(new IllegalStateException("db down")).when(store).markTriggered(eq(JOB_ID), any());

        JobResult result = job(store).run();

        assertThat(result.success()).isFalse();
        assertThat(((ThresholdOutcome) result.value()).action()).isEqualTo(TriggerAction.FAILED);
        assertThat(fired.get()).isZero();
        verify(store, never()).reset(any(), any());
    }

    @Test
    void forceTriggerIgnoresCount() {
        InMemoryThresholdBaselineStore store = new InMemoryThresholdBaselineStore();
        store.recordChanges(JOB_ID, 3);

        ThresholdOutcome outcome = job(store).forceTrigger();

        assertThat(outcome.action()).isEqualTo(TriggerAction.TRIGGERED);
        assertThat(outcome.count()).isEqualTo(3);
        assertThat(store.find(JOB_ID).orElseThrow().currentCount()).isZero();
    }

    /**
     * In-memory store whose first {@code failures} resets throw.
     */
    private static final class FailingResetStore extends InMemoryThresholdBaselineStore {
        private final AtomicInteger failuresLeft;

        FailingResetStore(int failures) {
            this.failuresLeft = new AtomicInteger(failures);
        }

        @Override
        public void reset(String jobId, Instant at) {
            if (failuresLeft.getAndDecrement() > 0) {
                throw new IllegalStateException("write timeout");
            }
            super.reset(jobId, at);
        }
    }
}
