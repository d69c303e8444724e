package io.cronwarden.remote;

/**
 * Raised where a non-success {@link InvokeOutcome} has to surface as an exception.
 */
public class RemoteActionException extends RuntimeException {

    private final transient InvokeOutcome outcome;

    public RemoteActionException(String message, InvokeOutcome outcome) {
        super(message + ": " + outcome.summary());
        this.outcome = outcome;
    }

    public InvokeOutcome outcome() {
        return outcome;
    }
}
