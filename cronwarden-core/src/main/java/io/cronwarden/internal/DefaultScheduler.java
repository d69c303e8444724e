package io.cronwarden.internal;

import io.cronwarden.JobResult;
import io.cronwarden.Scheduler;
import io.cronwarden.alert.AlertSink;
import io.cronwarden.core.ExecutionRecord;
import io.cronwarden.core.ExecutionStatus;
import io.cronwarden.core.FailureStreak;
import io.cronwarden.core.JobDefinition;
import io.cronwarden.core.JobRegistry;
import io.cronwarden.core.JobStatus;
import io.cronwarden.store.ExecutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minute-resolution scheduler.
 *
 * <p>A dispatcher thread wakes at every minute boundary and calls {@link #tick()}. Each due
 * job is supervised on the worker pool while its body runs on the job pool, so the supervisor
 * can enforce the job's timeout. At most one run per job id is in flight; a job still running
 * when it matches again is skipped for that minute.
 *
 * <p>If the dispatcher wakes late, the minutes it slept through are evaluated on the next tick,
 * going back at most the misfire grace period. A job due in several of those minutes runs once.
 *
 * <p>Typical usage:
 * <pre>{@code
 * Scheduler scheduler = new DefaultScheduler(registry, store, new LoggingAlertSink());
 * scheduler.start();
 * scheduler.runNow("batch-retraining");
 * scheduler.stop();
 * }</pre>
 */
public class DefaultScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultScheduler.class);

    public static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(30);
    public static final Duration DEFAULT_MISFIRE_GRACE = Duration.ofMinutes(5);

    // tick slightly after the boundary so the clock reads the new minute
    private static final long TICK_OFFSET_MS = 50;
    private static final String TIMEOUT_SUMMARY = "timeout";

    private final JobRegistry registry;
    private final ExecutionStore store;
    private final ExecutionRecorder recorder;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration shutdownGracePeriod;
    private final Duration misfireGrace;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final Map<String, Boolean> enabled = new ConcurrentHashMap<>();
    private final AtomicLong lastTickMinute = new AtomicLong(Long.MIN_VALUE);

    private ExecutorService workerPool;
    private ExecutorService jobPool;
    private Thread dispatcherThread;

    public DefaultScheduler(JobRegistry registry, ExecutionStore store, AlertSink alertSink) {
        this(registry, store, alertSink, Clock.systemUTC(), ZoneOffset.UTC, DEFAULT_SHUTDOWN_GRACE_PERIOD);
    }

    public DefaultScheduler(JobRegistry registry,
                            ExecutionStore store,
                            AlertSink alertSink,
                            Clock clock,
                            ZoneId zone,
                            Duration shutdownGracePeriod) {
        this(registry, store, alertSink, clock, zone, shutdownGracePeriod, DEFAULT_MISFIRE_GRACE);
    }

    public DefaultScheduler(JobRegistry registry,
                            ExecutionStore store,
                            AlertSink alertSink,
                            Clock clock,
                            ZoneId zone,
                            Duration shutdownGracePeriod,
                            Duration misfireGrace) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.shutdownGracePeriod = Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod must not be null");
        this.misfireGrace = Objects.requireNonNull(misfireGrace, "misfireGrace must not be null");
        if (misfireGrace.isNegative()) {
            throw new IllegalArgumentException("misfireGrace must not be negative");
        }
        this.recorder = new ExecutionRecorder(store, Objects.requireNonNull(alertSink, "alertSink must not be null"), clock);

        for (JobDefinition def : registry.all()) {
            enabled.put(def.id(), def.job().enabledAtStartup());
        }
    }

    /**
     * Register jobs with the store and start the minute dispatcher. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Cronwarden starting with jobs={}, zone={}, shutdownGracePeriod={}, misfireGrace={}",
                registry.size(), zone, shutdownGracePeriod, misfireGrace);

        for (JobDefinition def : registry.all()) {
            try {
                store.registerJob(def);
            } catch (Exception e) {
                log.warn("cronwarden registerJob failed jobId={} msg={}", def.id(), e.getMessage(), e);
            }
            log.info("Registered job id={} schedule='{}' kind={} timeout={} alertThreshold={} enabled={}",
                    def.id(), def.scheduleSource(), def.scheduleKind(), def.timeout(), def.alertThreshold(), enabled.get(def.id()));
        }

        synchronized (this) {
            ensurePools();
        }

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("cronwarden.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }
        log.info("Cronwarden started successfully.");
    }

    /**
     * Stop the dispatcher and wait for in-flight runs up to the grace period. Idempotent.
     *
     * <p>Pools created by {@link #tick()} or {@link #runNow(String)} without a prior
     * {@link #start()} are shut down as well.
     */
    @Override
    public void stop() {
        boolean wasStarted = started.getAndSet(false);

        ExecutorService workers;
        ExecutorService jobs;
        synchronized (this) {
            workers = workerPool;
            jobs = jobPool;
            workerPool = null;
            jobPool = null;
        }
        if (!wasStarted && workers == null && jobs == null) {
            return;
        }

        log.info("Cronwarden stopping... running={}", running);

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(shutdownGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Cronwarden grace period elapsed, abandoning running jobs={}", running);
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workers.shutdownNow();
            }
        }
        if (jobs != null) {
            jobs.shutdownNow();
        }
        log.info("Cronwarden stopped successfully.");
    }

    @Override
    public List<String> tick() {
        ZonedDateTime minute = ZonedDateTime.now(clock.withZone(zone)).truncatedTo(ChronoUnit.MINUTES);
        long epochMinute = minute.toEpochSecond() / 60;

        long last = lastTickMinute.get();
        if (epochMinute <= last || !lastTickMinute.compareAndSet(last, epochMinute)) {
            log.debug("Cronwarden minute already evaluated minute={}", minute);
            return List.of();
        }

        long firstMinute = epochMinute;
        if (last != Long.MIN_VALUE && last + 1 < epochMinute) {
            firstMinute = Math.max(last + 1, epochMinute - misfireGrace.toMinutes());
            if (firstMinute > last + 1) {
                log.warn("Cronwarden dropped minutes beyond misfire grace count={} grace={}",
                        firstMinute - last - 1, misfireGrace);
            }
            log.info("Cronwarden catching up missed minutes from={} to={}",
                    atEpochMinute(firstMinute), minute);
        }

        ExecutorService workers;
        ExecutorService jobs;
        synchronized (this) {
            ensurePools();
            workers = workerPool;
            jobs = jobPool;
        }

        List<String> startedJobs = new ArrayList<>();
        for (JobDefinition def : registry.all()) {
            if (!isEnabled(def.id()) || !isDue(def, firstMinute, epochMinute)) {
                continue;
            }
            if (!running.add(def.id())) {
                log.info("Skipping job still running jobId={} minute={}", def.id(), minute);
                continue;
            }
            try {
                workers.submit(() -> supervise(def, jobs));
                startedJobs.add(def.id());
            } catch (RejectedExecutionException e) {
                running.remove(def.id());
                log.error("cronwarden could not submit job jobId={} msg={}", def.id(), e.getMessage(), e);
            }
        }

        log.debug("Cronwarden tick minute={} started={}", minute, startedJobs);
        return startedJobs;
    }

    @Override
    public ExecutionRecord runNow(String jobId) {
        JobDefinition def = registry.getRequired(jobId);
        ExecutorService jobs;
        synchronized (this) {
            ensurePools();
            jobs = jobPool;
        }
        if (!running.add(jobId)) {
            log.info("runNow ignored, job already running jobId={}", jobId);
            return null;
        }
        try {
            return execute(def, jobs);
        } finally {
            running.remove(jobId);
        }
    }

    @Override
    public void enable(String jobId) {
        registry.getRequired(jobId);
        enabled.put(jobId, Boolean.TRUE);
        log.info("Job enabled jobId={}", jobId);
    }

    @Override
    public void disable(String jobId) {
        registry.getRequired(jobId);
        enabled.put(jobId, Boolean.FALSE);
        log.info("Job disabled jobId={}", jobId);
    }

    @Override
    public List<JobStatus> status() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        List<JobStatus> out = new ArrayList<>();
        for (JobDefinition def : registry.all()) {
            FailureStreak streak = FailureStreak.none(def.id());
            try {
                streak = store.failureStreak(def.id()).orElse(streak);
            } catch (Exception e) {
                log.warn("cronwarden failureStreak failed jobId={} msg={}", def.id(), e.getMessage(), e);
            }
            boolean on = isEnabled(def.id());
            ZonedDateTime next = on ? def.schedule().nextMatchAfter(now) : null;
            out.add(new JobStatus(
                    def.id(),
                    def.displayName(),
                    def.scheduleSource(),
                    def.scheduleKind(),
                    on,
                    running.contains(def.id()),
                    streak.consecutiveFailures(),
                    streak.lastRunAt(),
                    streak.lastSuccessfulRun(),
                    next == null ? null : next.toInstant()
            ));
        }
        return out;
    }

    @Override
    public List<ExecutionRecord> recentExecutions(String jobId, int limit) {
        registry.getRequired(jobId);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        return store.recent(jobId, limit);
    }

    public boolean isRunning(String jobId) {
        return running.contains(jobId);
    }

    public boolean isEnabled(String jobId) {
        return Boolean.TRUE.equals(enabled.get(jobId));
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                long now = clock.millis();
                long nextMinute = (Math.floorDiv(now, 60_000L) + 1) * 60_000L;
                Thread.sleep(nextMinute - now + TICK_OFFSET_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (!started.get()) {
                break;
            }

            try {
                tick();
            } catch (Exception e) {
                log.error("cronwarden tick failed msg={}", e.getMessage(), e);
            }
        }
    }

    private boolean isDue(JobDefinition def, long fromMinute, long toMinute) {
        for (long m = fromMinute; m <= toMinute; m++) {
            if (def.schedule().matches(atEpochMinute(m))) {
                return true;
            }
        }
        return false;
    }

    private ZonedDateTime atEpochMinute(long epochMinute) {
        return ZonedDateTime.ofInstant(Instant.ofEpochSecond(epochMinute * 60), zone);
    }

    // visible for tests
    synchronized boolean hasPools() {
        return workerPool != null || jobPool != null;
    }

    private void supervise(JobDefinition def, ExecutorService jobs) {
        try {
            execute(def, jobs);
        } catch (Exception e) {
            log.error("cronwarden supervision failed jobId={} msg={}", def.id(), e.getMessage(), e);
        } finally {
            running.remove(def.id());
        }
    }

    private ExecutionRecord execute(JobDefinition def, ExecutorService jobs) {
        ExecutionRecord record = recorder.start(def);
        log.info("Job started jobId={} executionId={}", def.id(), record.id());

        ExecutionStatus status;
        String summary;
        Future<JobResult> future = null;
        try {
            future = jobs.submit(() -> def.job().run());
            JobResult result = future.get(def.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                status = ExecutionStatus.OK;
                summary = "completed";
            } else {
                status = result.success() ? ExecutionStatus.OK : ExecutionStatus.ERROR;
                summary = result.summary();
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            status = ExecutionStatus.ERROR;
            summary = TIMEOUT_SUMMARY;
            log.warn("Job timed out jobId={} timeout={}", def.id(), def.timeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            status = ExecutionStatus.ERROR;
            summary = describe(cause);
            log.error("Job failed jobId={} msg={}", def.id(), cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            status = ExecutionStatus.ERROR;
            summary = "interrupted";
            log.warn("Job interrupted jobId={}", def.id());
        } catch (RuntimeException e) {
            status = ExecutionStatus.ERROR;
            summary = describe(e);
            log.error("Job could not be run jobId={} msg={}", def.id(), e.getMessage(), e);
        }

        ExecutionRecord completed = recorder.complete(def, record, status, summary);
        log.info("Job finished jobId={} status={} durationMs={} summary={}",
                def.id(), completed.status(), completed.durationMs(), completed.resultSummary());
        return completed;
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + msg;
    }

    // guarded by this
    private void ensurePools() {
        if (workerPool == null) {
            workerPool = Executors.newCachedThreadPool(daemonFactory("cronwarden.worker"));
        }
        if (jobPool == null) {
            jobPool = Executors.newCachedThreadPool(daemonFactory("cronwarden.job"));
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
