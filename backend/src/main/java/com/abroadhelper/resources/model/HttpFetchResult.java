package com.abroadhelper.resources.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean hasResponse() {
        return errorCode == null && statusCode > 0;
    }

    public boolean isClientError() {
        return hasResponse() && statusCode >= 400 && statusCode < 500;
    }

    public boolean isServerError() {
        return hasResponse() && statusCode >= 500;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
