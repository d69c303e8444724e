package io.cronwarden.internal;

import io.cronwarden.JobResult;
import io.cronwarden.MutableClock;
import io.cronwarden.TestJob;
import io.cronwarden.alert.AlertSink;
import io.cronwarden.core.ExecutionRecord;
import io.cronwarden.core.ExecutionStatus;
import io.cronwarden.core.JobRegistry;
import io.cronwarden.core.JobStatus;
import io.cronwarden.internal.memory.InMemoryExecutionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DefaultSchedulerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
    private final InMemoryExecutionStore store = new InMemoryExecutionStore();
    private final AlertSink alertSink = mock(AlertSink.class);
    private DefaultScheduler scheduler;

    private DefaultScheduler scheduler(TestJob... jobs) {
        scheduler = new DefaultScheduler(new JobRegistry(List.of(jobs)), store, alertSink, clock, ZoneOffset.UTC,
                Duration.ofSeconds(5));
        return scheduler;
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Test
    void tickStartsOnlyDueJobs() throws Exception {
        scheduler(TestJob.ok("hourly", "0 * * * *"), TestJob.ok("daily", "0 3 * * *"));

        List<String> started = scheduler.tick();

        assertThat(started).containsExactly("hourly");
        awaitIdle("hourly", 1);
        ExecutionRecord record = store.recent("hourly", 10).get(0);
        assertThat(record.status()).isEqualTo(ExecutionStatus.OK);
        assertThat(record.resultSummary()).isEqualTo("done");
        assertThat(store.recent("daily", 10)).isEmpty();
    }

    @Test
    void sameMinuteIsEvaluatedOnce() throws Exception {
        scheduler(TestJob.ok("every-minute", "* * * * *"));

        assertThat(scheduler.tick()).containsExactly("every-minute");
        clock.advance(Duration.ofSeconds(30));
        assertThat(scheduler.tick()).isEmpty();

        awaitIdle("every-minute", 1);
    }

    @Test
    void runningJobIsSkippedNotQueued() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        scheduler(new TestJob("slow", "* * * * *", () -> {
            runs.incrementAndGet();
            release.await(5, TimeUnit.SECONDS);
            return JobResult.ok("done");
        }));

        assertThat(scheduler.tick()).containsExactly("slow");
        assertThat(waitUntil(() -> runs.get() == 1)).isTrue();

        clock.advance(Duration.ofMinutes(1));
        assertThat(scheduler.tick()).isEmpty();
        clock.advance(Duration.ofMinutes(1));
        assertThat(scheduler.tick()).isEmpty();

        release.countDown();
        assertThat(waitUntil(() -> !scheduler.isRunning("slow"))).isTrue();
        assertThat(runs.get()).isEqualTo(1);
        assertThat(store.recent("slow", 10)).hasSize(1);

        clock.advance(Duration.ofMinutes(1));
        assertThat(scheduler.tick()).containsExactly("slow");
    }

    @Test
    void lateTickRunsJobDueInSkippedMinute() throws Exception {
        scheduler(TestJob.ok("at-01", "1 10 * * *"));

        clock.set(Instant.parse("2026-01-05T10:00:10Z"));
        assertThat(scheduler.tick()).isEmpty();
        clock.set(Instant.parse("2026-01-05T10:02:00Z"));
        assertThat(scheduler.tick()).containsExactly("at-01");

        awaitIdle("at-01", 1);
    }

    @Test
    void jobDueSeveralTimesWhileLateRunsOnce() throws Exception {
        scheduler(TestJob.ok("every-minute", "* * * * *"));

        assertThat(scheduler.tick()).containsExactly("every-minute");
        awaitIdle("every-minute", 1);
        clock.advance(Duration.ofMinutes(4));
        assertThat(scheduler.tick()).containsExactly("every-minute");

        awaitIdle("every-minute", 2);
    }

    @Test
    void minutesOlderThanMisfireGraceAreDropped() {
        scheduler = new DefaultScheduler(new JobRegistry(List.of(TestJob.ok("at-01", "1 10 * * *"))), store, alertSink,
                clock, ZoneOffset.UTC, Duration.ofSeconds(5), Duration.ofMinutes(2));

        clock.set(Instant.parse("2026-01-05T10:00:10Z"));
        assertThat(scheduler.tick()).isEmpty();
        clock.set(Instant.parse("2026-01-05T10:05:00Z"));
        assertThat(scheduler.tick()).isEmpty();
    }

    @Test
    void firstTickDoesNotLookBeforeItsOwnMinute() {
        clock.set(Instant.parse("2026-01-05T10:02:00Z"));
        scheduler(TestJob.ok("at-01", "1 10 * * *"));

        assertThat(scheduler.tick()).isEmpty();
    }

    @Test
    void exceptionBecomesErrorRecord() throws Exception {
        scheduler(new TestJob("broken", "* * * * *", () -> {
            throw new IllegalStateException("upstream unavailable");
        }));

        scheduler.tick();

        awaitIdle("broken", 1);
        ExecutionRecord record = store.recent("broken", 1).get(0);
        assertThat(record.status()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(record.resultSummary()).contains("upstream unavailable");
        assertThat(store.failureStreak("broken").orElseThrow().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void failedResultBecomesErrorRecord() {
        scheduler(new TestJob("rejected", "* * * * *", () -> JobResult.failed("http_error status=503")));

        ExecutionRecord record = scheduler.runNow("rejected");

        assertThat(record.status()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(record.resultSummary()).isEqualTo("http_error status=503");
    }

    @Test
    void slowJobIsRecordedAsTimeout() {
        scheduler(new TestJob("stuck", "* * * * *", () -> {
            Thread.sleep(10_000);
            return JobResult.ok("never");
        }).timeout(Duration.ofMillis(200)));

        ExecutionRecord record = scheduler.runNow("stuck");

        assertThat(record.status()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(record.resultSummary()).isEqualTo("timeout");
        assertThat(scheduler.isRunning("stuck")).isFalse();
    }

    @Test
    void hourlyJobFailingThreeTimesEscalatesOnce() throws Exception {
        scheduler(new TestJob("hourly", "0 * * * *", () -> {
            throw new IllegalStateException("boom");
        }));

        for (int hour = 0; hour < 3; hour++) {
            scheduler.tick();
            int expected = hour + 1;
            awaitIdle("hourly", expected);
            verify(alertSink, hour < 2 ? never() : times(1)).jobFailing(any(), anyInt(), any());
            clock.advance(Duration.ofHours(1));
        }

        verify(alertSink, times(1)).jobFailing(argThat(def -> def.id().equals("hourly")), eq(3), any());
        assertThat(store.recent("hourly", 10)).allMatch(r -> r.status() == ExecutionStatus.ERROR);
    }

    @Test
    void successResetsStreak() {
        AtomicInteger calls = new AtomicInteger();
        scheduler(new TestJob("flaky", "* * * * *", () ->
                calls.incrementAndGet() < 3 ? JobResult.failed("nope") : JobResult.ok("fine")));

        scheduler.runNow("flaky");
        scheduler.runNow("flaky");
        assertThat(store.failureStreak("flaky").orElseThrow().consecutiveFailures()).isEqualTo(2);

        scheduler.runNow("flaky");
        assertThat(store.failureStreak("flaky").orElseThrow().consecutiveFailures()).isZero();
    }

    @Test
    void recordsOfOneJobNeverOverlap() throws Exception {
        scheduler(new TestJob("quick", "* * * * *", () -> JobResult.ok("done")));

        for (int i = 0; i < 5; i++) {
            scheduler.tick();
            int expected = i + 1;
            awaitIdle("quick", expected);
            clock.advance(Duration.ofMinutes(1));
        }

        List<ExecutionRecord> records = store.recent("quick", 10);
        assertThat(records).hasSize(5);
        for (int i = 0; i + 1 < records.size(); i++) {
            ExecutionRecord newer = records.get(i);
            ExecutionRecord older = records.get(i + 1);
            assertThat(older.completedAt()).isBeforeOrEqualTo(newer.startedAt());
        }
    }

    @Test
    void disabledJobsAreSkippedByTickButCanRunNow() {
        scheduler(TestJob.ok("manual", "* * * * *").disabled(), TestJob.ok("auto", "* * * * *"));

        assertThat(scheduler.tick()).containsExactly("auto");
        assertThat(scheduler.runNow("manual").status()).isEqualTo(ExecutionStatus.OK);

        scheduler.enable("manual");
        scheduler.disable("auto");
        clock.advance(Duration.ofMinutes(1));
        assertThat(scheduler.tick()).containsExactly("manual");
    }

    @Test
    void runNowWhileRunningIsIgnored() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        scheduler(new TestJob("slow", "0 0 1 1 *", () -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return JobResult.ok("done");
        }));

        Thread first = new Thread(() -> scheduler.runNow("slow"));
        first.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(scheduler.runNow("slow")).isNull();

        release.countDown();
        first.join(5000);
        assertThat(store.recent("slow", 10)).hasSize(1);
    }

    @Test
    void stopReleasesPoolsCreatedByRunNowWithoutStart() {
        scheduler(TestJob.ok("manual", "0 0 1 1 *"));

        scheduler.runNow("manual");
        assertThat(scheduler.hasPools()).isTrue();

        scheduler.stop();

        assertThat(scheduler.hasPools()).isFalse();
    }

    @Test
    void statusReportsStreakAndNextRun() {
        clock.set(Instant.parse("2026-01-05T10:20:00Z"));
        scheduler(new TestJob("hourly", "0 * * * *", () -> JobResult.failed("nope")), TestJob.ok("off", "0 * * * *").disabled());

        scheduler.runNow("hourly");
        List<JobStatus> status = scheduler.status();

        assertThat(status).hasSize(2);
        JobStatus hourly = status.get(0);
        assertThat(hourly.id()).isEqualTo("hourly");
        assertThat(hourly.enabled()).isTrue();
        assertThat(hourly.running()).isFalse();
        assertThat(hourly.consecutiveFailures()).isEqualTo(1);
        assertThat(hourly.nextRunAt()).isEqualTo(Instant.parse("2026-01-05T11:00:00Z"));
        assertThat(status.get(1).enabled()).isFalse();
        assertThat(status.get(1).nextRunAt()).isNull();
    }

    @Test
    void startRegistersJobsWithStore() {
        scheduler(TestJob.ok("collect", "*/15 * * * *"));

        scheduler.start();
        scheduler.start();

        assertThat(store.failureStreak("collect")).isPresent();
    }

    @Test
    void unknownJobIdsAreRejected() {
        scheduler(TestJob.ok("collect", "* * * * *"));

        assertThatThrownBy(() -> scheduler.runNow("missing")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.disable("missing")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.recentExecutions("collect", 0)).isInstanceOf(IllegalArgumentException.class);
    }

    private void awaitIdle(String jobId, long expectedCompleted) throws InterruptedException {
        assertThat(waitUntil(() -> completed(jobId) == expectedCompleted && !scheduler.isRunning(jobId))).isTrue();
    }

    private long completed(String jobId) {
        return store.recent(jobId, 100).stream().filter(ExecutionRecord::isCompleted).count();
    }

    private static boolean waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }
}
