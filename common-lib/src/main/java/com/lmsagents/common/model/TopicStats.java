package com.lmsagents.common.model;

/**
 * Per-topic answer counts. {@link #percentage()} is unrounded and is what threshold
 * checks use; {@link #roundedPercentage()} is for display and generator prompts.
 */
public record TopicStats(
    long topicId,
    int total,
    int correct
) {
    public double percentage() {
        return total == 0 ? 0.0 : correct * 100.0 / total;
    }

    public double roundedPercentage() {
        return Math.round(percentage() * 10.0) / 10.0;
    }

    public boolean isBelow(double threshold) {
        return percentage() < threshold;
    }
}
