package com.abroadhelper.resources.robots;

import com.abroadhelper.config.ResourceProperties;
import com.abroadhelper.resources.http.PoliteHttpClient;
import com.abroadhelper.resources.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers whether a URL may be fetched under its site's robots policy. A policy that cannot be read
 * denies every path. Readable policies are cached per robots URL until {@code resources.robots.cache-ttl}
 * passes; unreadable ones are fetched again on the next call.
 */
@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);

    private final ResourceProperties properties;
    private final PoliteHttpClient httpClient;
    private final Clock clock;
    private final Map<String, CachedPolicy> cache = new ConcurrentHashMap<>();

    public RobotsTxtService(ResourceProperties properties, PoliteHttpClient httpClient, Clock clock) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    /** Checks {@code targetUrl} against the policy at the target host's {@code /robots.txt}. */
    public boolean isAllowed(String targetUrl, String userAgent) {
        URI target = toUri(targetUrl);
        if (target == null || target.getHost() == null || target.getScheme() == null) {
            log.error("robots check rejected malformed url={}", targetUrl);
            return false;
        }
        String robotsUrl = target.getScheme() + "://" + target.getRawAuthority() + "/robots.txt";
        return isAllowed(targetUrl, robotsUrl, userAgent);
    }

    public boolean isAllowed(String targetUrl, String robotsUrl, String userAgent) {
        URI target = toUri(targetUrl);
        if (target == null || target.getHost() == null) {
            log.error("robots check rejected malformed url={}", targetUrl);
            return false;
        }
        RobotsRules rules = rulesFor(robotsUrl);
        if (rules == null) {
            return false;
        }
        String path = target.getRawPath() == null || target.getRawPath().isBlank() ? "/" : target.getRawPath();
        if (target.getRawQuery() != null && !target.getRawQuery().isBlank()) {
            path = path + "?" + target.getRawQuery();
        }
        boolean allowed = rules.isAllowed(userAgent, path);
        if (!allowed) {
            log.warn("URL disallowed by robots.txt url={} agent={}", targetUrl, userAgent);
        }
        return allowed;
    }

    /** Returns the policy for {@code robotsUrl}, or {@code null} when it cannot be read. */
    RobotsRules rulesFor(String robotsUrl) {
        if (robotsUrl == null || robotsUrl.isBlank()) {
            log.error("robots check without robots url, denying");
            return null;
        }
        String key = robotsUrl.trim();
        Instant now = clock.instant();
        CachedPolicy cached = cache.get(key);
        if (cached != null) {
            if (!isExpired(cached, now)) {
                return cached.rules();
            }
            cache.remove(key, cached);
        }
        RobotsRules loaded = load(key);
        if (loaded != null && !properties.getRobots().getCacheTtl().isZero()) {
            cache.put(key, new CachedPolicy(loaded, now));
            evict(now);
        }
        return loaded;
    }

    private RobotsRules load(String robotsUrl) {
        HttpFetchResult fetch;
        try {
            fetch = httpClient.fetchOnce(robotsUrl);
        } catch (RuntimeException e) {
            log.error("Error checking robots.txt robotsUrl={} decision=disallow_all", robotsUrl, e);
            return null;
        }
        if (fetch == null || !fetch.hasResponse()) {
            log.error(
                "robots fetch failed robotsUrl={} errorCode={} errorMessage={} decision=disallow_all",
                robotsUrl,
                fetch == null ? null : fetch.errorCode(),
                fetch == null ? null : fetch.errorMessage()
            );
            return null;
        }
        int status = fetch.statusCode();
        if (status == 401 || status == 403) {
            log.warn("robots access refused robotsUrl={} status={} decision=disallow_all", robotsUrl, status);
            return RobotsRules.disallowAll();
        }
        if (status >= 400 && status < 500) {
            log.debug("No robots policy at {} (status {}), allowing all", robotsUrl, status);
            return RobotsRules.allowAll();
        }
        if (status < 200 || status >= 300) {
            log.error("robots fetch failed robotsUrl={} status={} decision=disallow_all", robotsUrl, status);
            return null;
        }
        try {
            RobotsRules rules = RobotsRules.parse(fetch.body());
            log.debug("Loaded robots from {} with {} sitemap hints", robotsUrl, rules.getSitemapUrls().size());
            return rules;
        } catch (RuntimeException e) {
            log.error("robots parse failed robotsUrl={} decision=disallow_all", robotsUrl, e);
            return null;
        }
    }

    private boolean isExpired(CachedPolicy policy, Instant now) {
        Duration ttl = properties.getRobots().getCacheTtl();
        return policy.loadedAt().plus(ttl).isBefore(now);
    }

    private void evict(Instant now) {
        cache.entrySet().removeIf(entry -> isExpired(entry.getValue(), now));

        int max = properties.getRobots().getMaxCachedPolicies();
        while (cache.size() > max) {
            String oldestKey = null;
            Instant oldestLoaded = null;
            for (Map.Entry<String, CachedPolicy> entry : cache.entrySet()) {
                if (oldestLoaded == null || entry.getValue().loadedAt().isBefore(oldestLoaded)) {
                    oldestLoaded = entry.getValue().loadedAt();
                    oldestKey = entry.getKey();
                }
            }
            if (oldestKey == null) {
                break;
            }
            cache.remove(oldestKey);
        }
    }

    int cachedPolicyCount() {
        return cache.size();
    }

    private URI toUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private record CachedPolicy(RobotsRules rules, Instant loadedAt) {}
}
