package io.cronwarden.core;

/**
 * Issue severity, ordered from most to least severe.
 */
public enum Severity {
    CRITICAL,
    WARNING,
    INFO
}
