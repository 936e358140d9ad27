package com.abroadhelper.resources.http;

import java.time.Duration;

/** Blocking pause used for rate limiting and retry backoff. */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
