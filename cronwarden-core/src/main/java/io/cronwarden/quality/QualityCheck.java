package io.cronwarden.quality;

import io.cronwarden.core.Issue;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * One data quality check. Returning an empty list means the check passed; throwing marks
 * only this check as errored.
 */
public interface QualityCheck {

    String id();

    List<Issue> run() throws Exception;

    static QualityCheck of(String id, Callable<List<Issue>> body) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(body, "body must not be null");
        return new QualityCheck() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public List<Issue> run() throws Exception {
                return body.call();
            }
        };
    }
}
