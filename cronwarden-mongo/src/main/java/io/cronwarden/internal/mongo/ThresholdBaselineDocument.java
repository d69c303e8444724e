package io.cronwarden.internal.mongo;

import io.cronwarden.core.ThresholdBaseline;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "threshold_baselines")
public class ThresholdBaselineDocument {

    @Id
    private String id;

    private Instant lastTriggerAt;
    private long currentCount;
    private long threshold;
    private Instant pendingResetAt;

    public ThresholdBaselineDocument() {
    }

    ThresholdBaseline toBaseline() {
        return new ThresholdBaseline(id, lastTriggerAt, currentCount, threshold, pendingResetAt);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getLastTriggerAt() {
        return lastTriggerAt;
    }

    public void setLastTriggerAt(Instant lastTriggerAt) {
        this.lastTriggerAt = lastTriggerAt;
    }

    public long getCurrentCount() {
        return currentCount;
    }

    public void setCurrentCount(long currentCount) {
        this.currentCount = currentCount;
    }

    public long getThreshold() {
        return threshold;
    }

    public void setThreshold(long threshold) {
        this.threshold = threshold;
    }

    public Instant getPendingResetAt() {
        return pendingResetAt;
    }

    public void setPendingResetAt(Instant pendingResetAt) {
        this.pendingResetAt = pendingResetAt;
    }
}
