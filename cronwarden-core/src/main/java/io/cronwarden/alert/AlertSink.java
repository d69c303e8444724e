package io.cronwarden.alert;

import io.cronwarden.core.ExecutionRecord;
import io.cronwarden.core.Issue;
import io.cronwarden.core.JobDefinition;
import io.cronwarden.core.Tier;

import java.util.List;

/**
 * Escalation channel, separate from ordinary logging. Implementations must not throw for
 * delivery problems they can handle themselves; callers log and continue on any exception.
 */
public interface AlertSink {

    /**
     * A job's consecutive failures reached its alert threshold.
     */
    void jobFailing(JobDefinition job, int consecutiveFailures, ExecutionRecord lastExecution);

    /**
     * A quality tier run produced critical issues.
     */
    void criticalIssues(Tier tier, String runId, List<Issue> issues);
}
