package com.feedreader.ingest.feed.model;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one GET. Only the raw bytes are held; {@link #body()} decodes them when a caller wants text.
 */
public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean hasBody() {
        return bodyBytes != null && bodyBytes.length > 0;
    }

    public String body() {
        return bodyBytes == null ? null : new String(bodyBytes, StandardCharsets.UTF_8);
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
