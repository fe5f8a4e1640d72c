package com.lmsagents.common.scoring;

import com.lmsagents.common.model.AnswerRecord;
import com.lmsagents.common.model.StudentPerformanceSnapshot;
import com.lmsagents.common.model.TopicStats;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless aggregation of raw answers into a {@link StudentPerformanceSnapshot}.
 * Deterministic for a given answer list and {@code now}.
 */
public final class PerformanceCalculator {

    public static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private PerformanceCalculator() {}

    public static StudentPerformanceSnapshot snapshot(long studentId, List<AnswerRecord> answers, Instant now) {
        if (answers == null || answers.isEmpty()) {
            return new StudentPerformanceSnapshot(studentId, 0, 0, 0.0, null, Map.of());
        }
        int total   = answers.size();
        int correct = (int) answers.stream().filter(AnswerRecord::correct).count();

        Instant cutoff = now.minus(RECENT_WINDOW);
        List<AnswerRecord> recent = answers.stream()
            .filter(a -> a.answeredAt() != null && !a.answeredAt().isBefore(cutoff))
            .toList();
        Double recentScore = recent.isEmpty() ? null
            : percentage((int) recent.stream().filter(AnswerRecord::correct).count(), recent.size());

        return new StudentPerformanceSnapshot(studentId, total, correct,
            percentage(correct, total), recentScore, byTopic(answers));
    }

    /** Per-topic counts in first-seen topic order. */
    public static Map<Long, TopicStats> byTopic(List<AnswerRecord> answers) {
        Map<Long, int[]> counts = new LinkedHashMap<>();
        for (AnswerRecord a : answers) {
            int[] c = counts.computeIfAbsent(a.topicId(), id -> new int[2]);
            c[0]++;
            if (a.correct()) c[1]++;
        }
        Map<Long, TopicStats> stats = new LinkedHashMap<>();
        counts.forEach((topicId, c) -> stats.put(topicId, new TopicStats(topicId, c[0], c[1])));
        return Collections.unmodifiableMap(stats);
    }

    /** {@code correct / total} as a percentage rounded to one decimal; 0 when there are no answers. */
    public static double percentage(int correct, int total) {
        if (total <= 0) return 0.0;
        return round1(correct * 100.0 / total);
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
