package io.cronwarden.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cronwarden.JobResult;
import io.cronwarden.core.ThresholdBaseline;
import io.cronwarden.trigger.ThresholdTriggerJob;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Threshold action that posts the configured params, plus the accumulated change count,
 * to a remote endpoint.
 */
public class RemoteThresholdAction implements ThresholdTriggerJob.Action {

    private final URI target;
    private final Map<String, Object> params;
    private final Map<String, String> headers;
    private final Duration timeout;
    private final ActionInvoker invoker;
    private final ObjectMapper objectMapper;

    public RemoteThresholdAction(URI target,
                                 Map<String, Object> params,
                                 Map<String, String> headers,
                                 Duration timeout,
                                 ActionInvoker invoker,
                                 ObjectMapper objectMapper) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.params = params == null ? Map.of() : Map.copyOf(params);
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.timeout = timeout;
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public JobResult fire(ThresholdBaseline baseline) {
        ObjectNode payload = objectMapper.valueToTree(params);
        payload.put("changeCount", baseline.currentCount());
        payload.put("threshold", baseline.threshold());

        InvokeOutcome outcome = invoker.invoke(new InvokeRequest(target, "POST", payload, headers, timeout, null));
        if (outcome instanceof InvokeOutcome.Success success) {
            return JobResult.ok(success.summary(), success.body());
        }
        return JobResult.failed(outcome.summary(), outcome);
    }
}
