package io.cronwarden.internal.memory;

import io.cronwarden.core.ThresholdBaseline;
import io.cronwarden.store.ThresholdBaselineStore;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryThresholdBaselineStore implements ThresholdBaselineStore {

    private final Map<String, ThresholdBaseline> baselines = new ConcurrentHashMap<>();

    @Override
    public Optional<ThresholdBaseline> find(String jobId) {
        return Optional.ofNullable(baselines.get(jobId));
    }

    @Override
    public ThresholdBaseline ensure(String jobId, long threshold) {
        return baselines.compute(jobId, (id, b) -> b == null
                ? ThresholdBaseline.empty(id, threshold)
                : new ThresholdBaseline(id, b.lastTriggerAt(), b.currentCount(), threshold, b.pendingResetAt()));
    }

    @Override
    public long recordChanges(String jobId, long delta) {
        return baselines.compute(jobId, (id, b) -> {
            ThresholdBaseline current = b == null ? ThresholdBaseline.empty(id, 0) : b;
            return new ThresholdBaseline(id, current.lastTriggerAt(), current.currentCount() + delta,
                    current.threshold(), current.pendingResetAt());
        }).currentCount();
    }

    @Override
    public void markTriggered(String jobId, Instant at) {
        baselines.compute(jobId, (id, b) -> {
            ThresholdBaseline current = b == null ? ThresholdBaseline.empty(id, 0) : b;
            return new ThresholdBaseline(id, current.lastTriggerAt(), current.currentCount(), current.threshold(), at);
        });
    }

    @Override
    public void clearPendingReset(String jobId) {
        baselines.computeIfPresent(jobId, (id, b) ->
                new ThresholdBaseline(id, b.lastTriggerAt(), b.currentCount(), b.threshold(), null));
    }

    @Override
    public void reset(String jobId, Instant at) {
        baselines.compute(jobId, (id, b) -> {
            long threshold = b == null ? 0 : b.threshold();
            return new ThresholdBaseline(id, at, 0, threshold, null);
        });
    }
}
