package io.cronwarden.internal.mongo;

import io.cronwarden.core.ExecutionRecord;
import io.cronwarden.core.FailureStreak;
import io.cronwarden.core.JobDefinition;
import io.cronwarden.store.ExecutionStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for execution history ({@code job_executions}) and per-job state
 * ({@code scheduled_jobs}).
 *
 * <p>Failure counters are changed with a single {@code findAndModify}/upsert each, so concurrent
 * completions of different runs never lose an increment.
 */
public class MongoExecutionStore implements ExecutionStore {

    private final MongoTemplate mongoTemplate;

    public MongoExecutionStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void registerJob(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        Update update = new Update()
                .set("displayName", definition.displayName())
                .set("schedule", definition.scheduleSource())
                .set("cron", definition.schedule().source())
                .set("scheduleKind", definition.scheduleKind())
                .set("metadata", definition.metadata())
                .setOnInsert("consecutiveFailures", 0);
        mongoTemplate.upsert(byId(definition.id()), update, JobStateDocument.class);
    }

    @Override
    public void insertStarted(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        mongoTemplate.insert(JobExecutionDocument.from(record));
    }

    /**
     * Write the completion fields. Upserts so a run whose start write was lost is still recorded.
     */
    @Override
    public void complete(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Update update = new Update()
                .set("completedAt", record.completedAt())
                .set("status", record.status())
                .set("resultSummary", record.resultSummary())
                .set("durationMs", record.durationMs())
                .setOnInsert("jobId", record.jobId())
                .setOnInsert("startedAt", record.startedAt());
        mongoTemplate.upsert(byId(record.id()), update, JobExecutionDocument.class);
    }

    @Override
    public List<ExecutionRecord> recent(String jobId, int limit) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = new Query(Criteria.where("jobId").is(jobId))
                .with(Sort.by(Sort.Order.desc("startedAt")))
                .limit(limit);
        return mongoTemplate.find(q, JobExecutionDocument.class).stream()
                .map(JobExecutionDocument::toRecord)
                .toList();
    }

    @Override
    public int incrementFailures(String jobId, Instant at) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Update update = new Update()
                .inc("consecutiveFailures", 1)
                .set("lastRunAt", at);
        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true).upsert(true);
        JobStateDocument doc = mongoTemplate.findAndModify(byId(jobId), update, options, JobStateDocument.class);
        return doc == null ? 0 : doc.getConsecutiveFailures();
    }

    @Override
    public void resetFailures(String jobId, Instant at) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Update update = new Update()
                .set("consecutiveFailures", 0)
                .set("lastRunAt", at)
                .set("lastSuccessfulRun", at);
        mongoTemplate.upsert(byId(jobId), update, JobStateDocument.class);
    }

    @Override
    public Optional<FailureStreak> failureStreak(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(jobId, JobStateDocument.class))
                .map(JobStateDocument::toStreak);
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }
}
