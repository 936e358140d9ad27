package com.abroadhelper.resources.http;

import com.abroadhelper.config.ResourceProperties;
import com.abroadhelper.resources.model.FetchOutcome;
import com.abroadhelper.resources.model.FetchStatus;
import com.abroadhelper.resources.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * HTTP access for the scraper and the validator. Every {@link #fetch} attempt waits on the shared
 * {@link RateLimiter}; 5xx responses and transport failures are retried with exponential backoff,
 * 4xx responses are returned at once.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);

    private final ResourceProperties properties;
    private final HttpClient client;
    private final RateLimiter rateLimiter;
    private final Sleeper sleeper;

    public PoliteHttpClient(
        ResourceProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        RateLimiter rateLimiter,
        Sleeper sleeper
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.rateLimiter = rateLimiter;
        this.sleeper = sleeper;
    }

    public FetchOutcome get(String url) {
        return fetch(url, "GET", null);
    }

    public FetchOutcome postForm(String url, Map<String, String> formData) {
        return fetch(url, "POST", formData);
    }

    public FetchOutcome fetch(String url, String method, Map<String, String> formData) {
        String safeMethod = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        if (!safeMethod.equals("GET") && !safeMethod.equals("POST") && !safeMethod.equals("HEAD")) {
            throw new IllegalArgumentException("Unsupported method: " + method);
        }
        int maxAttempts = 1 + properties.getMaxRetries();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (!acquireSlot()) {
                return new FetchOutcome(FetchStatus.INTERRUPTED, lastResult, attempt - 1);
            }
            log.info("Fetching: {}", url);
            lastResult = executeOnce(url, safeMethod, formData, properties.getUserAgent());
            FetchStatus terminal = terminalStatus(lastResult);
            if (terminal != null) {
                if (terminal == FetchStatus.CLIENT_ERROR) {
                    log.error("Client error {} for {}", lastResult.statusCode(), url);
                }
                return new FetchOutcome(terminal, lastResult, attempt);
            }
            if (attempt >= maxAttempts) {
                break;
            }
            Duration backoff = backoffFor(attempt - 1);
            log.warn(
                "Retryable failure for {} status={} errorCode={}, retrying in {} ms (attempt {}/{})",
                url,
                lastResult.statusCode(),
                lastResult.errorCode(),
                backoff.toMillis(),
                attempt,
                maxAttempts - 1
            );
            if (!sleepBackoff(backoff)) {
                return new FetchOutcome(FetchStatus.INTERRUPTED, lastResult, attempt);
            }
        }
        log.error("Max retries exceeded for {}", url);
        FetchStatus exhausted = lastResult != null && lastResult.hasResponse()
            ? FetchStatus.RETRIES_EXHAUSTED
            : FetchStatus.TRANSPORT_FAILURE;
        return new FetchOutcome(exhausted, lastResult, maxAttempts);
    }

    /** Single rate-limited GET without retries. */
    public HttpFetchResult fetchOnce(String url) {
        if (!acquireSlot()) {
            return errorResult(url, Instant.now(), "interrupted", "interrupted while rate limiting");
        }
        return executeOnce(url, "GET", null, properties.getUserAgent());
    }

    /** Single HEAD request, neither rate limited nor retried. */
    public HttpFetchResult probe(String url, String userAgent) {
        return executeOnce(url, "HEAD", null, userAgent);
    }

    private HttpFetchResult executeOnce(String url, String method, Map<String, String> formData, String userAgent) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", userAgent)
                .header("Accept-Language", "en-US,en;q=0.8");
            HttpRequest request;
            if ("POST".equals(method)) {
                request = builder
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(encodeForm(formData), StandardCharsets.UTF_8))
                    .build();
            } else if ("HEAD".equals(method)) {
                request = builder.method("HEAD", HttpRequest.BodyPublishers.noBody()).build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }
    }

    private FetchStatus terminalStatus(HttpFetchResult result) {
        String errorCode = result.errorCode();
        if (errorCode != null) {
            return switch (errorCode) {
                case "invalid_url" -> FetchStatus.INVALID_URL;
                case "interrupted" -> FetchStatus.INTERRUPTED;
                default -> null;
            };
        }
        if (result.isClientError()) {
            return FetchStatus.CLIENT_ERROR;
        }
        if (result.isServerError()) {
            return null;
        }
        return FetchStatus.SUCCESS;
    }

    private Duration backoffFor(int retry) {
        return Duration.ofMillis((long) properties.getRetryBaseDelayMs() * (1L << Math.min(retry, 20)));
    }

    private boolean acquireSlot() {
        try {
            rateLimiter.acquire();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean sleepBackoff(Duration backoff) {
        if (backoff.isZero()) {
            return true;
        }
        try {
            sleeper.sleep(backoff);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private static String encodeForm(Map<String, String> formData) {
        if (formData == null || formData.isEmpty()) {
            return "";
        }
        return formData.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    private static URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(input.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
