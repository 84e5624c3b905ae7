package com.commitpulse.pipeline.analysis;

import java.time.LocalDate;

/**
 * A run of consecutive UTC calendar days on which one author committed.
 */
public record Streak(String label, LocalDate start, LocalDate end, int lengthDays) {}
