package com.commitpulse.pipeline.client;

import java.time.Duration;

/**
 * Blocks the calling thread while the API quota resets.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
