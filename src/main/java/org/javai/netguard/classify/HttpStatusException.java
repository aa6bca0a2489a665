package org.javai.netguard.classify;

import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Signals a completed HTTP exchange whose status code means the fetch failed.
 * Transports throw this so the classifier can read the status and headers.
 */
public class HttpStatusException extends Exception {

    private final int statusCode;
    private final Map<String, List<String>> headers;

    public HttpStatusException(int statusCode, Map<String, List<String>> headers, String message) {
        super(message);
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be a valid HTTP status, was: " + statusCode);
        }
        Objects.requireNonNull(headers, "headers must not be null");
        this.statusCode = statusCode;
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        this.headers = copy;
    }

    public HttpStatusException(int statusCode) {
        this(statusCode, Map.of(), "HTTP " + statusCode);
    }

    /**
     * Wraps an unsuccessful {@link HttpResponse}.
     */
    public static HttpStatusException of(HttpResponse<?> response) {
        Objects.requireNonNull(response, "response must not be null");
        return new HttpStatusException(
                response.statusCode(),
                response.headers().map(),
                "HTTP " + response.statusCode() + " from " + response.uri());
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Returns the first value of a header, matched case-insensitively.
     */
    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }
}
