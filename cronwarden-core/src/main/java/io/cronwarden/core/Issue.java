package io.cronwarden.core;

import java.util.Objects;

/**
 * A single finding reported by a quality check.
 *
 * @param severity    how urgent the finding is
 * @param type        category, e.g. {@code missing_field} or {@code stale_data}
 * @param entity      the table, source or job the finding is about
 * @param field       optional column or attribute
 * @param count       number of affected records
 * @param description human-readable message
 */
public record Issue(Severity severity, String type, String entity, String field, long count, String description) {

    public Issue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
    }

    public static Issue critical(String type, String entity, String description) {
        return new Issue(Severity.CRITICAL, type, entity, null, 1, description);
    }

    public static Issue warning(String type, String entity, String description) {
        return new Issue(Severity.WARNING, type, entity, null, 1, description);
    }

    public static Issue info(String type, String entity, String description) {
        return new Issue(Severity.INFO, type, entity, null, 1, description);
    }
}
