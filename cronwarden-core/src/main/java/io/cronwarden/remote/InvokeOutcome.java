package io.cronwarden.remote;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Classified result of an external call.
 *
 * <ul>
 *   <li>{@link Success} - 2xx with a decodable body</li>
 *   <li>{@link HttpError} - non-2xx status</li>
 *   <li>{@link DecodeError} - 2xx but the body is not the expected JSON</li>
 *   <li>{@link NetworkError} - no response (connection failure or timeout)</li>
 * </ul>
 */
public sealed interface InvokeOutcome permits
        InvokeOutcome.Success,
        InvokeOutcome.HttpError,
        InvokeOutcome.DecodeError,
        InvokeOutcome.NetworkError {

    int MAX_BODY_IN_SUMMARY = 200;

    String summary();

    default boolean isSuccess() {
        return false;
    }

    /**
     * @param body decoded JSON, {@code NullNode} for an empty body
     */
    record Success(int status, JsonNode body) implements InvokeOutcome {
        @Override
        public String summary() {
            return "HTTP " + status;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record HttpError(int status, String body) implements InvokeOutcome {
        @Override
        public String summary() {
            return "http_error status=" + status + (body == null || body.isBlank() ? "" : " body=" + truncate(body));
        }
    }

    record DecodeError(int status, String body, String detail) implements InvokeOutcome {
        @Override
        public String summary() {
            return "decode_error status=" + status + " detail=" + detail;
        }
    }

    record NetworkError(String detail, boolean timedOut) implements InvokeOutcome {
        @Override
        public String summary() {
            return (timedOut ? "network_timeout: " : "network_error: ") + detail;
        }
    }

    private static String truncate(String s) {
        return s.length() <= MAX_BODY_IN_SUMMARY ? s : s.substring(0, MAX_BODY_IN_SUMMARY) + "...";
    }
}
