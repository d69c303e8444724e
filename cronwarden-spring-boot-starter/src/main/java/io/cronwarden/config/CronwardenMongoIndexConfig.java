package io.cronwarden.config;

import io.cronwarden.internal.mongo.JobExecutionDocument;
import io.cronwarden.internal.mongo.QualityIssueDocument;
import io.cronwarden.internal.mongo.QualityResultDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the cronwarden stores.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code cronwarden.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_job_started</b> on {@code job_executions}: { jobId: 1, startedAt: -1 }
 *       <br/>Used by recent-execution lookups per job.</li>
 *   <li><b>idx_completed</b> on {@code data_quality_results}: { completedAt: -1 }
 *       <br/>Used by the weekly rollup window query.</li>
 *   <li><b>idx_detected_severity</b> on {@code data_quality_issues}: { detectedAt: -1, severity: 1 }
 *       <br/>Used by the weekly rollup and severity dashboards.</li>
 * </ul>
 *
 * <p>{@code scheduled_jobs} and {@code threshold_baselines} are keyed by job id and need no extra index.
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.job_executions.createIndex({ jobId: 1, startedAt: -1 }, { name: "idx_job_started" });
 * db.data_quality_results.createIndex({ completedAt: -1 }, { name: "idx_completed" });
 * db.data_quality_issues.createIndex({ detectedAt: -1, severity: 1 }, { name: "idx_detected_severity" });
 * </pre>
 */
public class CronwardenMongoIndexConfig {

    public static final String IDX_JOB_STARTED = "idx_job_started";
    public static final String IDX_COMPLETED = "idx_completed";
    public static final String IDX_DETECTED_SEVERITY = "idx_detected_severity";

    private final MongoTemplate mongoTemplate;

    public CronwardenMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(jobStartedIndex());
        mongoTemplate.indexOps(QualityResultDocument.class).ensureIndex(completedIndex());
        mongoTemplate.indexOps(QualityIssueDocument.class).ensureIndex(detectedSeverityIndex());
    }

    public static Index jobStartedIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_JOB_STARTED);
    }

    public static Index completedIndex() {
        return new Index()
                .on("completedAt", Sort.Direction.DESC)
                .named(IDX_COMPLETED);
    }

    public static Index detectedSeverityIndex() {
        return new Index()
                .on("detectedAt", Sort.Direction.DESC)
                .on("severity", Sort.Direction.ASC)
                .named(IDX_DETECTED_SEVERITY);
    }
}
