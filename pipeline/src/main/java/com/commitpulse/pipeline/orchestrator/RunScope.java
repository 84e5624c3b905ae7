package com.commitpulse.pipeline.orchestrator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * The repository and time window one pipeline run covers.
 */
public record RunScope(String repoFullName, Instant since, Instant until) {

    /**
     * Window ending now and starting the given number of calendar months earlier (UTC).
     */
    public static RunScope trailingMonths(String repoFullName, int months, Clock clock) {
        if (months <= 0) {
            throw new IllegalArgumentException("months must be positive: " + months);
        }
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        return new RunScope(repoFullName, now.minusMonths(months).toInstant(), now.toInstant());
    }
}
