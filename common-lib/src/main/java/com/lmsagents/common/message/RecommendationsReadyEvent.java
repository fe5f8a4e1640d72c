package com.lmsagents.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Adaptation → Router completion event. {@code aiUsed} is true only when at least one
 * recommendation text actually came from the external generator.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecommendationsReadyEvent(
    @JsonProperty("student_id")            Long studentId,
    @JsonProperty("recommendations_count") Integer recommendationsCount,
    @JsonProperty("ai_used")               Boolean aiUsed
) implements AgentMessage {

    public RecommendationsReadyEvent {
        Objects.requireNonNull(recommendationsCount, "recommendations_count is required");
        Objects.requireNonNull(aiUsed, "ai_used is required");
    }

    @Override
    public MessageType type() {
        return MessageType.RECOMMENDATIONS_READY;
    }
}
