package io.cronwarden.remote;

/**
 * Calls an external service. Every call returns exactly one {@link InvokeOutcome} and is
 * attempted once; retries are left to the next scheduled run.
 */
public interface ActionInvoker {

    InvokeOutcome invoke(InvokeRequest request);
}
