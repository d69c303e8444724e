package io.cronwarden.remote;

import com.fasterxml.jackson.databind.JsonNode;
import io.cronwarden.core.Issue;
import io.cronwarden.core.Severity;
import io.cronwarden.quality.QualityCheck;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Quality check evaluated by a remote endpoint that answers with a JSON array of issues,
 * or an object holding one under {@code "issues"}.
 *
 * <pre>
 * [{"severity": "warning", "type": "missing_field", "table": "trades", "field": "ticker",
 *   "count": 12, "description": "12 trades without ticker"}]
 * </pre>
 */
public class RemoteQualityCheck implements QualityCheck {

    private final String id;
    private final InvokeRequest request;
    private final ActionInvoker invoker;

    public RemoteQualityCheck(String id, InvokeRequest request, ActionInvoker invoker) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.request = Objects.requireNonNull(request, "request must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<Issue> run() {
        InvokeOutcome outcome = invoker.invoke(request);
        if (!(outcome instanceof InvokeOutcome.Success success)) {
            throw new RemoteActionException("Quality check " + id + " failed", outcome);
        }

        JsonNode body = success.body();
        if (body.isObject() && body.has("issues")) {
            body = body.get("issues");
        }
        if (body.isNull() || body.isMissingNode()) {
            return List.of();
        }
        if (!body.isArray()) {
            throw new IllegalStateException("Quality check " + id + " expected an array of issues");
        }

        List<Issue> issues = new ArrayList<>(body.size());
        for (JsonNode n : body) {
            issues.add(new Issue(
                    severity(n.path("severity").asText("warning")),
                    n.path("type").asText(id),
                    text(n, "entity", "table"),
                    text(n, "field", null),
                    Math.max(0, n.path("count").asLong(1)),
                    n.path("description").asText("")
            ));
        }
        return issues;
    }

    private static Severity severity(String raw) {
        try {
            return Severity.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Severity.WARNING;
        }
    }

    private static String text(JsonNode n, String field, String fallbackField) {
        JsonNode v = n.get(field);
        if ((v == null || v.isNull()) && fallbackField != null) {
            v = n.get(fallbackField);
        }
        return v == null || v.isNull() ? null : v.asText();
    }
}
