package com.abroadhelper.resources.http;

import com.abroadhelper.resources.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    @Test
    void firstAcquireReturnsImmediatelyAndNextWaitsForRemainingDelay() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        List<Duration> sleeps = new ArrayList<>();
        RateLimiter limiter = new RateLimiter(Duration.ofSeconds(2), clock, duration -> {
            sleeps.add(duration);
            clock.advance(duration);
        });

        limiter.acquire();
        assertThat(sleeps).isEmpty();

        clock.advance(Duration.ofMillis(500));
        limiter.acquire();
        assertThat(sleeps).containsExactly(Duration.ofMillis(1500));

        clock.advance(Duration.ofSeconds(3));
        limiter.acquire();
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void negativeDelayIsTreatedAsZero() throws Exception {
        List<Duration> sleeps = new ArrayList<>();
        RateLimiter limiter = new RateLimiter(Duration.ofSeconds(-1), Clock.systemUTC(), sleeps::add);

        limiter.acquire();
        limiter.acquire();

        assertThat(limiter.getDelay()).isEqualTo(Duration.ZERO);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void concurrentCallersAreSerialized() throws Exception {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(50), Clock.systemUTC(), Sleeper.SYSTEM);
        ExecutorService executor = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Long>> releases = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                releases.add(executor.submit(() -> {
                    start.await();
                    limiter.acquire();
                    return System.nanoTime();
                }));
            }
            long startedAt = System.nanoTime();
            start.countDown();

            long lastRelease = 0;
            for (Future<Long> release : releases) {
                lastRelease = Math.max(lastRelease, release.get(5, TimeUnit.SECONDS));
            }
            assertThat(Duration.ofNanos(lastRelease - startedAt)).isGreaterThanOrEqualTo(Duration.ofMillis(90));
        } finally {
            executor.shutdownNow();
        }
    }
}
