package com.siteaudit.scan.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    String contentEncoding,
    Map<String, String> headers,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public HttpFetchResult {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    /**
     * Short machine-readable reason for an unsuccessful fetch.
     */
    public String failureReason() {
        if (errorCode != null) {
            return errorCode;
        }
        return statusCode > 0 ? "http_" + statusCode : "unknown_error";
    }

    /**
     * Response header lookup; names are stored lower-cased.
     */
    public String header(String name) {
        return name == null ? null : headers.get(name.toLowerCase(Locale.ROOT));
    }
}
