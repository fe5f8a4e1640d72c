package com.lmsagents.common.model;

import java.time.Instant;

/**
 * A remediation hint for one student. {@code topicId == null} means the whole program
 * rather than a single topic.
 */
public record RecommendationRecord(
    Long id,
    long studentId,
    Long topicId,
    String text,
    GeneratedBy generatedBy,
    Instant createdAt
) {
    public static RecommendationRecord of(long studentId, Long topicId, String text,
                                          GeneratedBy generatedBy, Instant createdAt) {
        return new RecommendationRecord(null, studentId, topicId, text, generatedBy, createdAt);
    }

    public RecommendationRecord withId(long newId) {
        return new RecommendationRecord(newId, studentId, topicId, text, generatedBy, createdAt);
    }

    public boolean isGeneral() {
        return topicId == null;
    }
}
