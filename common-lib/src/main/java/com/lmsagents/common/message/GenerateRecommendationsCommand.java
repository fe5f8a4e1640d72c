package com.lmsagents.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Router → Adaptation. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerateRecommendationsCommand(
    @JsonProperty("student_id")   Long studentId,
    @JsonProperty("student_name") String studentName,
    @JsonProperty("score")        Double score
) implements AgentMessage {

    public GenerateRecommendationsCommand {
        Objects.requireNonNull(studentId, "student_id is required");
        Objects.requireNonNull(score, "score is required");
        studentName = studentName == null ? "" : studentName;
    }

    @Override
    public MessageType type() {
        return MessageType.GENERATE_RECOMMENDATIONS;
    }
}
