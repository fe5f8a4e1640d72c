package com.lmsagents.adaptation.generator;

/** Input for one topic-level (or whole-program) recommendation. */
public record RecommendationRequest(
    String studentName,
    String topicTitle,
    double scorePct,
    int totalAnswers,
    int correctAnswers
) {}
