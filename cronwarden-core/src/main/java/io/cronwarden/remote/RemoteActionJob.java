package io.cronwarden.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronwarden.JobResult;
import io.cronwarden.ScheduledJob;
import io.cronwarden.core.ScheduleKind;
import io.cronwarden.trigger.MarketGatedJob;
import io.cronwarden.trigger.MarketSessionGate;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generic executor for a {@link JobSpec}: sends the spec's params to its target and maps the
 * outcome to a {@link JobResult}.
 */
public class RemoteActionJob implements ScheduledJob {

    private final JobSpec spec;
    private final ActionInvoker invoker;
    private final ObjectMapper objectMapper;

    public RemoteActionJob(JobSpec spec, ActionInvoker invoker, ObjectMapper objectMapper) {
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Build the job for a spec, wrapped in a market-session gate when the spec asks for it.
     */
    public static ScheduledJob from(JobSpec spec, ActionInvoker invoker, ObjectMapper objectMapper,
                                    MarketSessionGate gate, Clock clock) {
        ScheduledJob job = new RemoteActionJob(spec, invoker, objectMapper);
        if (spec.marketHoursOnly()) {
            Objects.requireNonNull(gate, "gate must not be null for market-hours job " + spec.id());
            return new MarketGatedJob(job, gate, clock);
        }
        return job;
    }

    @Override
    public String id() {
        return spec.id();
    }

    @Override
    public String displayName() {
        return spec.name();
    }

    @Override
    public String schedule() {
        return spec.schedule();
    }

    @Override
    public ScheduleKind scheduleKind() {
        return spec.scheduleKind();
    }

    @Override
    public Duration timeout() {
        return spec.timeout();
    }

    @Override
    public int alertThreshold() {
        return spec.alertThreshold();
    }

    @Override
    public boolean enabledAtStartup() {
        return spec.enabled();
    }

    @Override
    public Map<String, Object> metadata() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("target", spec.target().toString());
        m.put("method", spec.method());
        if (!spec.params().isEmpty()) {
            m.put("params", spec.params());
        }
        return m;
    }

    public JobSpec spec() {
        return spec;
    }

    @Override
    public JobResult run() {
        InvokeOutcome outcome = invoker.invoke(toRequest());
        if (outcome instanceof InvokeOutcome.Success success) {
            return JobResult.ok(success.summary(), success.body());
        }
        return JobResult.failed(outcome.summary(), outcome);
    }

    InvokeRequest toRequest() {
        JsonNode payload = spec.params().isEmpty() && "GET".equalsIgnoreCase(spec.method())
                ? null
                : objectMapper.valueToTree(spec.params());
        return new InvokeRequest(spec.target(), spec.method(), payload, spec.headers(), spec.timeout(), spec.requiredFields());
    }
}
