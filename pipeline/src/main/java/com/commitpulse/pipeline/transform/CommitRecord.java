package com.commitpulse.pipeline.transform;

import java.time.Instant;

/**
 * A normalized commit referencing its author and committer by stable key.
 * {@code authoredAt} may be null when the API omitted the author date.
 */
public record CommitRecord(
        String sha,
        String authorKey,
        String committerKey,
        Instant authoredAt,
        Instant committedAt,
        String message
) {}
