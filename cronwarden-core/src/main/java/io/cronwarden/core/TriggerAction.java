package io.cronwarden.core;

/**
 * What a threshold trigger pass did.
 */
public enum TriggerAction {
    /** Count reached the threshold, the action succeeded and the baseline was reset. */
    TRIGGERED,
    /** The action succeeded but resetting the baseline failed; the reset is retried next pass. */
    TRIGGERED_WITH_RESET_ERROR,
    /** A reset left over from an earlier pass is still failing. */
    RESET_PENDING,
    /** The action itself failed; the baseline is untouched. */
    FAILED,
    SKIPPED
}
