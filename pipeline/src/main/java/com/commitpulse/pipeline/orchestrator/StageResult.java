package com.commitpulse.pipeline.orchestrator;

/**
 * Record counts and duration of one completed pipeline stage.
 */
public record StageResult(
        String stage,
        int recordsIn,
        int recordsOut,
        long durationMs
) {}
