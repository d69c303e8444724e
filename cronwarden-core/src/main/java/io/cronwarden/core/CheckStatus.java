package io.cronwarden.core;

public enum CheckStatus {
    PASSED,
    WARNING,
    FAILED,
    ERROR
}
