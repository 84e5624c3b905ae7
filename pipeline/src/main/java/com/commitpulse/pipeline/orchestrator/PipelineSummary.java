package com.commitpulse.pipeline.orchestrator;

import java.util.List;

/**
 * Summary of a successful ETL run.
 */
public record PipelineSummary(
        RunScope scope,
        List<StageResult> stages,
        long totalDurationMs
) {

    public StageResult stage(String name) {
        return stages.stream()
                .filter(s -> s.stage().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No stage named " + name));
    }

    public int commitsLoaded() {
        return stage(PipelineOrchestrator.STAGE_LOAD).recordsOut();
    }
}
