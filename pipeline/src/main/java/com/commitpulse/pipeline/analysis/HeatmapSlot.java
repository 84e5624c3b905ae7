package com.commitpulse.pipeline.analysis;

/**
 * Heatmap cell key. {@code dayOfWeek} runs 0..6 starting at Sunday,
 * {@code hour} 0..23, both in UTC.
 */
public record HeatmapSlot(int dayOfWeek, int hour) {

    private static final String[] DAY_NAMES = {"Sun", "Mon", "Tue", "Wed", "Thu", "Fri", "Sat"};

    public HeatmapSlot {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("dayOfWeek must be 0..6: " + dayOfWeek);
        }
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be 0..23: " + hour);
        }
    }

    public String dayName() {
        return DAY_NAMES[dayOfWeek];
    }
}
