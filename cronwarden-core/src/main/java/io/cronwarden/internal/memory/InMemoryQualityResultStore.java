package io.cronwarden.internal.memory;

import io.cronwarden.core.Issue;
import io.cronwarden.core.QualityCheckResult;
import io.cronwarden.core.Tier;
import io.cronwarden.core.WeeklyRollup;
import io.cronwarden.store.QualityResultStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryQualityResultStore implements QualityResultStore {

    private record StoredIssues(Instant at, List<Issue> issues) {
    }

    private final List<QualityCheckResult> results = new CopyOnWriteArrayList<>();
    private final List<StoredIssues> issues = new CopyOnWriteArrayList<>();
    private final List<WeeklyRollup> rollups = new CopyOnWriteArrayList<>();

    @Override
    public void saveResult(QualityCheckResult result) {
        results.add(result);
    }

    @Override
    public void saveIssues(String runId, Tier tier, List<Issue> runIssues, Instant at) {
        issues.add(new StoredIssues(at, List.copyOf(runIssues)));
    }

    @Override
    public List<QualityCheckResult> resultsSince(Instant since) {
        return results.stream()
                .filter(r -> r.completedAt() != null && !r.completedAt().isBefore(since))
                .toList();
    }

    @Override
    public List<Issue> issuesSince(Instant since) {
        List<Issue> out = new ArrayList<>();
        for (StoredIssues s : issues) {
            if (!s.at().isBefore(since)) {
                out.addAll(s.issues());
            }
        }
        return out;
    }

    @Override
    public void saveRollup(WeeklyRollup rollup) {
        rollups.add(rollup);
    }

    public List<WeeklyRollup> rollups() {
        return List.copyOf(rollups);
    }
}
