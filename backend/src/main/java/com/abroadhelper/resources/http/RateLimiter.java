package com.abroadhelper.resources.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Enforces a minimum interval between consecutive requests.
 *
 * <p>Safe for concurrent use: callers are serialized on the limiter's monitor, so with N threads
 * waiting the last one is released roughly {@code N * delay} after the first.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Duration delay;
    private final Clock clock;
    private final Sleeper sleeper;
    private Instant lastReleasedAt;

    public RateLimiter(Duration delay, Clock clock, Sleeper sleeper) {
        this.delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until at least the configured delay has passed since the previous call returned. The
     * first call returns immediately.
     */
    public synchronized void acquire() throws InterruptedException {
        if (lastReleasedAt != null) {
            Duration elapsed = Duration.between(lastReleasedAt, clock.instant());
            Duration remaining = delay.minus(elapsed);
            if (!remaining.isNegative() && !remaining.isZero()) {
                log.debug("Rate limiting: sleeping for {} ms", remaining.toMillis());
                sleeper.sleep(remaining);
            }
        }
        lastReleasedAt = clock.instant();
    }

    Duration getDelay() {
        return delay;
    }
}
