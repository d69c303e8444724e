package io.cronwarden.alert;

import io.cronwarden.JobResult;
import io.cronwarden.ScheduledJob;
import io.cronwarden.core.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Drains the {@link DigestQueue} and hands the issues to a {@link DigestNotifier}.
 * Issues from a failed delivery go back on the queue for the next run.
 */
public class DigestFlushJob implements ScheduledJob {
    private static final Logger log = LoggerFactory.getLogger(DigestFlushJob.class);

    public static final String DEFAULT_ID = "email-digest";
    public static final String DEFAULT_SCHEDULE = "0 8 * * *";

    private final DigestQueue queue;
    private final DigestNotifier notifier;
    private final String schedule;

    public DigestFlushJob(DigestQueue queue, DigestNotifier notifier) {
        this(queue, notifier, DEFAULT_SCHEDULE);
    }

    public DigestFlushJob(DigestQueue queue, DigestNotifier notifier, String schedule) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
    }

    @Override
    public String id() {
        return DEFAULT_ID;
    }

    @Override
    public String displayName() {
        return "Daily Issue Digest";
    }

    @Override
    public String schedule() {
        return schedule;
    }

    @Override
    public JobResult run() {
        List<Issue> issues = queue.flush();
        if (issues.isEmpty()) {
            return JobResult.ok("no queued issues", 0);
        }
        try {
            notifier.deliverDigest(issues);
        } catch (Exception e) {
            queue.requeue(issues);
            log.warn("Digest delivery failed, requeued issues={} msg={}", issues.size(), e.getMessage(), e);
            return JobResult.failed("digest delivery failed: " + e.getMessage(), issues.size());
        }
        return JobResult.ok("delivered " + issues.size() + " issues", issues.size());
    }
}
