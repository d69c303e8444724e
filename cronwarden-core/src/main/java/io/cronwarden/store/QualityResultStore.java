package io.cronwarden.store;

import io.cronwarden.core.Issue;
import io.cronwarden.core.QualityCheckResult;
import io.cronwarden.core.Tier;
import io.cronwarden.core.WeeklyRollup;

import java.time.Instant;
import java.util.List;

public interface QualityResultStore {

    void saveResult(QualityCheckResult result);

    /**
     * Persist the aggregate issue list of one tier run.
     */
    void saveIssues(String runId, Tier tier, List<Issue> issues, Instant at);

    List<QualityCheckResult> resultsSince(Instant since);

    List<Issue> issuesSince(Instant since);

    void saveRollup(WeeklyRollup rollup);
}
