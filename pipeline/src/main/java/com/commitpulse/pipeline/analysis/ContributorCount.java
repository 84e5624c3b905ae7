package com.commitpulse.pipeline.analysis;

/**
 * One ranked row of a top-contributors query. Rank is 1-based.
 */
public record ContributorCount(int rank, String label, long commitCount) {}
