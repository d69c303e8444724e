package io.cronwarden.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * @param payload        JSON request body, or {@code null} for none
 * @param requiredFields top-level fields a successful response body must contain
 */
public record InvokeRequest(
        URI target,
        String method,
        JsonNode payload,
        Map<String, String> headers,
        Duration timeout,
        List<String> requiredFields
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public InvokeRequest {
        Objects.requireNonNull(target, "target must not be null");
        method = method == null || method.isBlank() ? "POST" : method.trim().toUpperCase(Locale.ROOT);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }

    public static InvokeRequest post(URI target, JsonNode payload, Duration timeout) {
        return new InvokeRequest(target, "POST", payload, Map.of(), timeout, List.of());
    }

    public static InvokeRequest get(URI target, Duration timeout) {
        return new InvokeRequest(target, "GET", null, Map.of(), timeout, List.of());
    }
}
