package com.kinoscope.metadata.resolve.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String userAgent,
    int attempts,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static final String SOFT_BLOCKED = "soft_blocked";

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean hasBody() {
        return isSuccessful() && body != null && !body.isBlank();
    }
}
