package io.cronwarden.internal.mongo;

import io.cronwarden.core.ThresholdBaseline;
import io.cronwarden.store.ThresholdBaselineStore;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for threshold baselines ({@code threshold_baselines}), one document per trigger job.
 */
public class MongoThresholdBaselineStore implements ThresholdBaselineStore {

    private final MongoTemplate mongoTemplate;

    public MongoThresholdBaselineStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<ThresholdBaseline> find(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(jobId, ThresholdBaselineDocument.class))
                .map(ThresholdBaselineDocument::toBaseline);
    }

    @Override
    public ThresholdBaseline ensure(String jobId, long threshold) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Update update = new Update()
                .set("threshold", threshold)
                .setOnInsert("currentCount", 0L);
        return modify(jobId, update).toBaseline();
    }

    @Override
    public long recordChanges(String jobId, long delta) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Update update = new Update()
                .inc("currentCount", delta)
                .setOnInsert("threshold", 0L);
        return modify(jobId, update).getCurrentCount();
    }

    @Override
    public void markTriggered(String jobId, Instant at) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(at, "at must not be null");
        Update update = new Update()
                .set("pendingResetAt", at)
                .setOnInsert("currentCount", 0L)
                .setOnInsert("threshold", 0L);
        mongoTemplate.upsert(byId(jobId), update, ThresholdBaselineDocument.class);
    }

    @Override
    public void clearPendingReset(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        mongoTemplate.updateFirst(byId(jobId), new Update().unset("pendingResetAt"), ThresholdBaselineDocument.class);
    }

    @Override
    public void reset(String jobId, Instant at) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Update update = new Update()
                .set("currentCount", 0L)
                .set("lastTriggerAt", at)
                .unset("pendingResetAt")
                .setOnInsert("threshold", 0L);
        mongoTemplate.upsert(byId(jobId), update, ThresholdBaselineDocument.class);
    }

    private static Query byId(String jobId) {
        return new Query(Criteria.where("_id").is(jobId));
    }

    private ThresholdBaselineDocument modify(String jobId, Update update) {
        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true).upsert(true);
        ThresholdBaselineDocument doc = mongoTemplate.findAndModify(
                byId(jobId), update, options, ThresholdBaselineDocument.class);
        if (doc == null) {
            throw new IllegalStateException("Baseline upsert returned no document for job " + jobId);
        }
        return doc;
    }
}
