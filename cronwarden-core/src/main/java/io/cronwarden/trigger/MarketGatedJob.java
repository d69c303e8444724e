package io.cronwarden.trigger;

import io.cronwarden.JobResult;
import io.cronwarden.ScheduledJob;
import io.cronwarden.core.ScheduleKind;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the delegate only while the market session is open. Outside the session the run
 * succeeds without doing any work.
 */
public class MarketGatedJob implements ScheduledJob {

    public static final String MARKET_CLOSED = "skipped: market closed";

    private final ScheduledJob delegate;
    private final MarketSessionGate gate;
    private final Clock clock;

    public MarketGatedJob(ScheduledJob delegate, MarketSessionGate gate, Clock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public JobResult run() throws Exception {
        if (!gate.isOpen(clock.instant())) {
            return JobResult.ok(MARKET_CLOSED);
        }
        return delegate.run();
    }

    @Override
    public String id() {
        return delegate.id();
    }

    @Override
    public String displayName() {
        return delegate.displayName();
    }

    @Override
    public String schedule() {
        return delegate.schedule();
    }

    @Override
    public ScheduleKind scheduleKind() {
        return delegate.scheduleKind();
    }

    @Override
    public Map<String, Object> metadata() {
        Map<String, Object> m = new LinkedHashMap<>(delegate.metadata());
        m.put("marketHoursOnly", true);
        return m;
    }

    @Override
    public Duration timeout() {
        return delegate.timeout();
    }

    @Override
    public int alertThreshold() {
        return delegate.alertThreshold();
    }

    @Override
    public boolean enabledAtStartup() {
        return delegate.enabledAtStartup();
    }
}
