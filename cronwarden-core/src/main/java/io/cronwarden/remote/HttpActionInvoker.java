package io.cronwarden.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link ActionInvoker} over the JDK {@link HttpClient}, exchanging JSON.
 */
public class HttpActionInvoker implements ActionInvoker {
    private static final Logger log = LoggerFactory.getLogger(HttpActionInvoker.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpActionInvoker(ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), objectMapper);
    }

    public HttpActionInvoker(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public InvokeOutcome invoke(InvokeRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        HttpResponse<String> response;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(request.target())
                    .timeout(request.timeout())
                    .header("Accept", "application/json");
            request.headers().forEach(builder::header);

            if (request.payload() == null) {
                builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
            } else {
                if (request.headers().keySet().stream().noneMatch("Content-Type"::equalsIgnoreCase)) {
                    builder.header("Content-Type", "application/json");
                }
                builder.method(request.method(),
                        HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(request.payload())));
            }

            log.debug("Invoking {} {}", request.method(), request.target());
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.warn("Invocation timed out target={} timeout={}", request.target(), request.timeout());
            return new InvokeOutcome.NetworkError(describe(e), true);
        } catch (IOException e) {
            log.warn("Invocation failed target={} msg={}", request.target(), describe(e));
            return new InvokeOutcome.NetworkError(describe(e), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new InvokeOutcome.NetworkError("interrupted", false);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid request target={} msg={}", request.target(), e.getMessage());
            return new InvokeOutcome.NetworkError("invalid request: " + e.getMessage(), false);
        }

        int status = response.statusCode();
        String body = response.body();
        if (status < 200 || status >= 300) {
            log.warn("Invocation returned error target={} status={}", request.target(), status);
            return new InvokeOutcome.HttpError(status, body);
        }
        return decode(status, body, request.requiredFields());
    }

    private InvokeOutcome decode(int status, String body, List<String> requiredFields) {
        JsonNode node;
        if (body == null || body.isBlank()) {
            node = NullNode.getInstance();
        } else {
            try {
                node = objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                return new InvokeOutcome.DecodeError(status, body, e.getOriginalMessage());
            }
        }

        if (!requiredFields.isEmpty()) {
            List<String> missing = requiredFields.stream().filter(f -> !node.hasNonNull(f)).toList();
            if (!missing.isEmpty()) {
                return new InvokeOutcome.DecodeError(status, body, "missing required fields " + missing);
            }
        }
        return new InvokeOutcome.Success(status, node);
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
