package com.lmsagents.adaptation.generator;

import java.util.List;

public record AnalysisRequest(
    String studentName,
    List<TopicResult> topics
) {
    public AnalysisRequest {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
