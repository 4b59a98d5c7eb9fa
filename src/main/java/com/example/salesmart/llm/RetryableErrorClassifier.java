package com.example.salesmart.llm;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Decides whether a failed model call is worth another attempt.
 *
 * <ol>
 * <li>Structured status first: HTTP status or provider status/code on
 * {@link ModelBackendException} / {@link WebClientResponseException}.</li>
 * <li>Network exceptions anywhere in the cause chain.</li>
 * <li>Opaque errors only: message text heuristics (best effort).</li>
 * </ol>
 */
@Component
public class RetryableErrorClassifier {

    private static final Map<String, ModelErrorKind> PROVIDER_CODES = Map.ofEntries(
            // Gemini (google.rpc.Code names)
            Map.entry("resource_exhausted", ModelErrorKind.RATE_LIMITED),
            Map.entry("unavailable", ModelErrorKind.OVERLOADED),
            Map.entry("internal", ModelErrorKind.SERVER_ERROR),
            Map.entry("deadline_exceeded", ModelErrorKind.TIMEOUT),
            // OpenAI / compatible proxies
            Map.entry("rate_limit_exceeded", ModelErrorKind.RATE_LIMITED),
            Map.entry("rate_limit_error", ModelErrorKind.RATE_LIMITED),
            Map.entry("overloaded_error", ModelErrorKind.OVERLOADED),
            Map.entry("server_error", ModelErrorKind.SERVER_ERROR),
            Map.entry("api_error", ModelErrorKind.SERVER_ERROR));

    private static final Set<Integer> SERVER_STATUSES = Set.of(500, 502, 504);

    private static final List<String> NETWORK_PHRASES = List.of(
            "no route to host", "errno 113", "connection refused", "connection reset",
            "network is unreachable", "network error");
    private static final List<String> TIMEOUT_PHRASES = List.of("connection timeout", "timed out");
    private static final List<String> RATE_LIMIT_PHRASES = List.of("rate limit", "too many requests");
    private static final List<String> OVERLOAD_PHRASES = List.of("overloaded", "unavailable");
    private static final Pattern STATUS_IN_TEXT = Pattern.compile("\\b(429|500|502|503|504)\\b");

    public boolean isRetryable(Throwable error) {
        return classify(error).isRetryable();
    }

    public ModelErrorKind classify(Throwable error) {
        if (error == null) {
            return ModelErrorKind.FATAL;
        }

        ModelBackendException backend = findCause(error, ModelBackendException.class);
        if (backend != null && backend.hasStructuredStatus()) {
            ModelErrorKind kind = fromProviderCode(backend.getProviderCode());
            if (kind == null) {
                kind = fromStatus(backend.getStatusCode());
            }
            return kind != null ? kind : ModelErrorKind.FATAL;
        }

        WebClientResponseException response = findCause(error, WebClientResponseException.class);
        if (response != null) {
            ModelErrorKind kind = fromStatus(response.getStatusCode().value());
            return kind != null ? kind : ModelErrorKind.FATAL;
        }

        ModelErrorKind network = fromExceptionType(error);
        if (network != null) {
            return network;
        }

        return fromText(error);
    }

    static ModelErrorKind fromStatus(Integer status) {
        if (status == null) {
            return null;
        }
        if (status == 429) {
            return ModelErrorKind.RATE_LIMITED;
        }
        if (status == 503) {
            return ModelErrorKind.OVERLOADED;
        }
        if (SERVER_STATUSES.contains(status)) {
            return ModelErrorKind.SERVER_ERROR;
        }
        return ModelErrorKind.FATAL;
    }

    static ModelErrorKind fromProviderCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return PROVIDER_CODES.get(code.trim().toLowerCase(Locale.ROOT));
    }

    private static ModelErrorKind fromExceptionType(Throwable error) {
        for (Throwable t = error; t != null; t = next(t)) {
            if (t instanceof NoRouteToHostException || t instanceof ConnectException
                    || t instanceof UnknownHostException) {
                return ModelErrorKind.NETWORK_UNREACHABLE;
            }
            if (t instanceof SocketTimeoutException || t instanceof TimeoutException) {
                return ModelErrorKind.TIMEOUT;
            }
        }
        return null;
    }

    /**
     * Last resort for third-party errors that carry nothing but a message.
     */
    private static ModelErrorKind fromText(Throwable error) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t = error; t != null; t = next(t)) {
            sb.append(t.getClass().getSimpleName()).append(' ');
            if (t.getMessage() != null) {
                sb.append(t.getMessage()).append(' ');
            }
        }
        String text = sb.toString().toLowerCase(Locale.ROOT);

        if (containsAny(text, NETWORK_PHRASES)) {
            return ModelErrorKind.NETWORK_UNREACHABLE;
        }
        if (containsAny(text, TIMEOUT_PHRASES)) {
            return ModelErrorKind.TIMEOUT;
        }
        if (containsAny(text, RATE_LIMIT_PHRASES)) {
            return ModelErrorKind.RATE_LIMITED;
        }
        if (containsAny(text, OVERLOAD_PHRASES)) {
            return ModelErrorKind.OVERLOADED;
        }
        var m = STATUS_IN_TEXT.matcher(text);
        if (m.find()) {
            return fromStatus(Integer.parseInt(m.group(1)));
        }
        return ModelErrorKind.FATAL;
    }

    private static boolean containsAny(String text, List<String> phrases) {
        return phrases.stream().anyMatch(text::contains);
    }

    private static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        for (Throwable t = error; t != null; t = next(t)) {
            if (type.isInstance(t)) {
                return type.cast(t);
            }
        }
        return null;
    }

    private static Throwable next(Throwable t) {
        Throwable cause = t.getCause();
        return cause == t ? null : cause;
    }
}
