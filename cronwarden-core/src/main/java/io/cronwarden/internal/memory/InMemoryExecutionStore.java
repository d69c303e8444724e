package io.cronwarden.internal.memory;

import io.cronwarden.core.ExecutionRecord;
import io.cronwarden.core.FailureStreak;
import io.cronwarden.core.JobDefinition;
import io.cronwarden.store.ExecutionStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ExecutionStore}. State is lost on restart.
 */
public class InMemoryExecutionStore implements ExecutionStore {

    private final Map<String, ExecutionRecord> executions = new ConcurrentHashMap<>();
    private final Map<String, FailureStreak> streaks = new ConcurrentHashMap<>();

    @Override
    public void registerJob(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        streaks.putIfAbsent(definition.id(), FailureStreak.none(definition.id()));
    }

    @Override
    public void insertStarted(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        executions.put(record.id(), record);
    }

    @Override
    public void complete(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        executions.put(record.id(), record);
    }

    @Override
    public List<ExecutionRecord> recent(String jobId, int limit) {
        List<ExecutionRecord> matching = new ArrayList<>();
        for (ExecutionRecord r : executions.values()) {
            if (r.jobId().equals(jobId)) {
                matching.add(r);
            }
        }
        matching.sort(Comparator.comparing(ExecutionRecord::startedAt).reversed());
        return matching.size() > limit ? List.copyOf(matching.subList(0, limit)) : List.copyOf(matching);
    }

    @Override
    public int incrementFailures(String jobId, Instant at) {
        return streaks.compute(jobId, (id, s) -> {
            FailureStreak current = s == null ? FailureStreak.none(id) : s;
            return new FailureStreak(id, current.consecutiveFailures() + 1, at, current.lastSuccessfulRun());
        }).consecutiveFailures();
    }

    @Override
    public void resetFailures(String jobId, Instant at) {
        streaks.put(jobId, new FailureStreak(jobId, 0, at, at));
    }

    @Override
    public Optional<FailureStreak> failureStreak(String jobId) {
        return Optional.ofNullable(streaks.get(jobId));
    }
}
