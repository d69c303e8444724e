package io.cronwarden.core;

public enum ExecutionStatus {
    RUNNING,
    OK,
    ERROR
}
