package io.cronwarden.alert;

import io.cronwarden.core.Issue;
import io.cronwarden.core.Severity;
import io.cronwarden.core.WeeklyRollup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class LoggingDigestNotifier implements DigestNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingDigestNotifier.class);

    @Override
    public void deliverDigest(List<Issue> issues) {
        long warnings = issues.stream().filter(i -> i.severity() == Severity.WARNING).count();
        log.info("Data quality digest issues={} warnings={} info={}", issues.size(), warnings, issues.size() - warnings);
        for (Issue issue : issues) {
            log.info("  [{}] type={} entity={} count={} description={}",
                    issue.severity(), issue.type(), issue.entity(), issue.count(), issue.description());
        }
    }

    @Override
    public void deliverWeeklySummary(WeeklyRollup rollup) {
        log.info("Weekly data quality summary week={} checks={} passRate={} issues={} byType={}",
                rollup.weekNumber(), rollup.totalChecks(), rollup.passRate(), rollup.totalIssues(), rollup.issuesByType());
    }
}
