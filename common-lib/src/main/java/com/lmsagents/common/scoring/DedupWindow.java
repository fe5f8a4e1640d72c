package com.lmsagents.common.scoring;

import java.time.Duration;
import java.time.Instant;

/**
 * Minimum spacing between two reports for the same (agent, student[, topic]) key,
 * measured from the most recent persisted record.
 */
public final class DedupWindow {

    public static final Duration MONITORING = Duration.ofHours(1);
    public static final Duration ADAPTATION = Duration.ofHours(2);

    private DedupWindow() {}

    /** True when a record at {@code lastRecordedAt} still blocks a new one at {@code now}. */
    public static boolean suppresses(Instant lastRecordedAt, Instant now, Duration window) {
        return lastRecordedAt != null && lastRecordedAt.isAfter(now.minus(window));
    }
}
