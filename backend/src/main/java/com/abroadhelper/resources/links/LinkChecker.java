package com.abroadhelper.resources.links;

import com.abroadhelper.config.ResourceProperties;
import com.abroadhelper.resources.http.PoliteHttpClient;
import com.abroadhelper.resources.model.HttpFetchResult;
import com.abroadhelper.resources.model.LinkCheckResult;
import com.abroadhelper.resources.model.LinkTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes resource URLs with single HEAD requests on the {@code linkCheckExecutor} pool. Probes are
 * not retried and not rate limited.
 */
@Service
public class LinkChecker {
    private static final Logger log = LoggerFactory.getLogger(LinkChecker.class);
    static final String DEADLINE_EXCEEDED = "deadline_exceeded";
    static final String INTERRUPTED = "interrupted";

    private final ResourceProperties properties;
    private final PoliteHttpClient httpClient;
    private final ExecutorService linkCheckExecutor;

    public LinkChecker(
        ResourceProperties properties,
        PoliteHttpClient httpClient,
        @Qualifier("linkCheckExecutor") ExecutorService linkCheckExecutor
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.linkCheckExecutor = linkCheckExecutor;
    }

    /**
     * Checks every target with a non-blank URL. The returned map is keyed by record id and holds
     * exactly one entry per checked target, independent of completion order.
     */
    public Map<String, LinkCheckResult> checkAll(Collection<LinkTarget> targets) {
        Map<String, LinkTarget> byId = new LinkedHashMap<>();
        for (LinkTarget target : targets) {
            if (target.url() == null || target.url().isBlank()) {
                continue;
            }
            byId.put(target.recordId(), target);
        }
        log.info("Checking {} URLs with up to {} workers", byId.size(), properties.getLinkCheck().getConcurrency());

        Map<String, CompletableFuture<LinkCheckResult>> futures = new LinkedHashMap<>();
        for (LinkTarget target : byId.values()) {
            futures.put(target.recordId(), CompletableFuture.supplyAsync(() -> check(target.url()), linkCheckExecutor));
        }

        String unfinishedReason = awaitAll(futures.values());

        Map<String, LinkCheckResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<LinkCheckResult>> entry : futures.entrySet()) {
            LinkTarget target = byId.get(entry.getKey());
            results.put(entry.getKey(), collect(target, entry.getValue(), unfinishedReason));
        }
        return results;
    }

    /** Probes one URL and classifies the response against the configured broken status codes. */
    public LinkCheckResult check(String url) {
        HttpFetchResult probe = httpClient.probe(url, properties.getLinkCheck().getUserAgent());
        if (!probe.hasResponse()) {
            log.warn("Error checking URL {}: {} {}", url, probe.errorCode(), probe.errorMessage());
            return LinkCheckResult.broken(0, probe.errorCode());
        }
        Set<Integer> brokenCodes = properties.getValidation().getBrokenStatusCodes();
        if (brokenCodes.contains(probe.statusCode())) {
            return LinkCheckResult.broken(probe.statusCode(), null);
        }
        return LinkCheckResult.live(probe.statusCode());
    }

    /** Waits for the probes and returns the reason to report for any left unfinished. */
    private String awaitAll(Collection<CompletableFuture<LinkCheckResult>> futures) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        Duration deadline = properties.getLinkCheck().getDeadline();
        try {
            if (deadline == null) {
                all.get();
            } else {
                all.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            int pending = 0;
            for (CompletableFuture<LinkCheckResult> future : futures) {
                // Queued probes never start once cancelled; running ones finish in the background.
                if (future.cancel(false)) {
                    pending++;
                }
            }
            log.warn("Link check deadline of {} passed with {} probes unfinished", deadline, pending);
            return DEADLINE_EXCEEDED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(false));
            log.warn("Link check interrupted, unfinished probes are reported as indeterminate");
            return INTERRUPTED;
        } catch (ExecutionException e) {
            // Individual failures are reported per target in collect().
            log.debug("At least one link probe failed", e.getCause());
        }
        return DEADLINE_EXCEEDED;
    }

    private LinkCheckResult collect(
        LinkTarget target,
        CompletableFuture<LinkCheckResult> future,
        String unfinishedReason
    ) {
        if (future.isCancelled() || !future.isDone()) {
            return LinkCheckResult.indeterminate(unfinishedReason);
        }
        try {
            LinkCheckResult result = future.join();
            if (!result.isLive()) {
                log.warn("Broken link [{}]: {} - {}", result.statusCode(), target.title(), target.url());
            }
            return result;
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Error checking {}: {}", target.title(), cause.toString());
            return LinkCheckResult.indeterminate("probe_error: " + cause.getClass().getSimpleName());
        }
    }
}
