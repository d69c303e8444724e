package io.cronwarden.core;

public record ThresholdOutcome(TriggerAction action, long count, long threshold, String detail) {

    public String summary() {
        String base = action.name().toLowerCase() + " count=" + count + " threshold=" + threshold;
        return detail == null ? base : base + " " + detail;
    }
}
