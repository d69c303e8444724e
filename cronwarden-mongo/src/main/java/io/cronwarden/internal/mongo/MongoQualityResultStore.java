package io.cronwarden.internal.mongo;

import io.cronwarden.core.Issue;
import io.cronwarden.core.QualityCheckResult;
import io.cronwarden.core.Tier;
import io.cronwarden.core.WeeklyRollup;
import io.cronwarden.store.QualityResultStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for quality results, issues and weekly rollups.
 */
public class MongoQualityResultStore implements QualityResultStore {

    private final MongoTemplate mongoTemplate;

    public MongoQualityResultStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void saveResult(QualityCheckResult result) {
        Objects.requireNonNull(result, "result must not be null");
        mongoTemplate.insert(QualityResultDocument.from(result));
    }

    @Override
    public void saveIssues(String runId, Tier tier, List<Issue> issues, Instant at) {
        Objects.requireNonNull(tier, "tier must not be null");
        if (issues == null || issues.isEmpty()) {
            return;
        }
        List<QualityIssueDocument> docs = issues.stream()
                .map(issue -> QualityIssueDocument.from(runId, tier, issue, at))
                .toList();
        mongoTemplate.insert(docs, QualityIssueDocument.class);
    }

    /**
     * Results completed at or after {@code since}. Embedded issue lists are capped, see
     * {@link QualityResultDocument}.
     */
    @Override
    public List<QualityCheckResult> resultsSince(Instant since) {
        Objects.requireNonNull(since, "since must not be null");
        Query q = new Query(Criteria.where("completedAt").gte(since))
                .with(Sort.by(Sort.Order.asc("completedAt")));
        return mongoTemplate.find(q, QualityResultDocument.class).stream()
                .map(QualityResultDocument::toResult)
                .toList();
    }

    @Override
    public List<Issue> issuesSince(Instant since) {
        Objects.requireNonNull(since, "since must not be null");
        Query q = new Query(Criteria.where("detectedAt").gte(since))
                .with(Sort.by(Sort.Order.asc("detectedAt")));
        return mongoTemplate.find(q, QualityIssueDocument.class).stream()
                .map(QualityIssueDocument::toIssue)
                .toList();
    }

    @Override
    public void saveRollup(WeeklyRollup rollup) {
        Objects.requireNonNull(rollup, "rollup must not be null");
        mongoTemplate.save(WeeklyRollupDocument.from(rollup));
    }

    /**
     * The rollup of the ISO week containing {@code instant}, if one was saved.
     */
    public Optional<WeeklyRollup> findRollup(Instant instant) {
        Objects.requireNonNull(instant, "instant must not be null");
        return Optional.ofNullable(mongoTemplate.findById(WeeklyRollupDocument.weekKey(instant), WeeklyRollupDocument.class))
                .map(WeeklyRollupDocument::toRollup);
    }
}
