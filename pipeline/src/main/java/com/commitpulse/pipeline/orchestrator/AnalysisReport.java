package com.commitpulse.pipeline.orchestrator;

import com.commitpulse.pipeline.analysis.ContributorCount;
import com.commitpulse.pipeline.analysis.HeatmapSlot;
import com.commitpulse.pipeline.analysis.Streak;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Results of every analysis run against the store.
 */
public record AnalysisReport(
        List<ContributorCount> topAuthors,
        List<ContributorCount> topCommitters,
        Optional<Streak> longestStreak,
        Map<HeatmapSlot, Long> heatmap
) {}
