package com.lmsagents.common.model;

import java.util.Map;

/**
 * Derived view of one student's answers, recomputed on every scan and never persisted.
 *
 * <ul>
 *   <li>{@code score}       – overall percentage, rounded to one decimal.</li>
 *   <li>{@code recentScore} – percentage over the recent window; {@code null} when the
 *       student has no answers inside it.</li>
 *   <li>{@code topics}      – per-topic breakdown keyed by topic id, in first-seen order.</li>
 * </ul>
 */
public record StudentPerformanceSnapshot(
    long studentId,
    int totalAnswers,
    int correctAnswers,
    double score,
    Double recentScore,
    Map<Long, TopicStats> topics
) {
    public boolean hasAnswers() {
        return totalAnswers > 0;
    }

    public Severity severity() {
        return Severity.fromScore(score);
    }
}
