package io.cronwarden.alert;

import io.cronwarden.core.ExecutionRecord;
import io.cronwarden.core.Issue;
import io.cronwarden.core.JobDefinition;
import io.cronwarden.core.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes escalations to the {@code cronwarden.alerts} logger so they can be routed to their
 * own appender.
 */
public class LoggingAlertSink implements AlertSink {
    public static final String LOGGER_NAME = "cronwarden.alerts";

    private static final Logger alerts = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void jobFailing(JobDefinition job, int consecutiveFailures, ExecutionRecord lastExecution) {
        alerts.error("Job failing jobId={} name={} consecutiveFailures={} threshold={} lastResult={}",
                job.id(),
                job.displayName(),
                consecutiveFailures,
                job.alertThreshold(),
                lastExecution == null ? null : lastExecution.resultSummary());
    }

    @Override
    public void criticalIssues(Tier tier, String runId, List<Issue> issues) {
        alerts.error("Critical data quality issues tier={} runId={} count={}", tier, runId, issues.size());
        for (Issue issue : issues) {
            alerts.error("  type={} entity={} field={} count={} description={}",
                    issue.type(), issue.entity(), issue.field(), issue.count(), issue.description());
        }
    }
}
