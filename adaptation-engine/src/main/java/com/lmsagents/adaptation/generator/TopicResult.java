package com.lmsagents.adaptation.generator;

/** One line of a student's per-topic results, {@code pct} rounded to one decimal. */
public record TopicResult(
    String topicTitle,
    int total,
    int correct,
    double pct
) {}
