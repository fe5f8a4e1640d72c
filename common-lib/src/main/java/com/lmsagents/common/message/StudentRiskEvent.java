package com.lmsagents.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lmsagents.common.model.Severity;

import java.util.Objects;

/** Monitoring → Router: a student fell below the risk threshold. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StudentRiskEvent(
    @JsonProperty("student_id")   Long studentId,
    @JsonProperty("student_name") String studentName,
    @JsonProperty("score")        Double score,
    @JsonProperty("recent_score") Double recentScore,
    @JsonProperty("severity")     Severity severity
) implements AgentMessage {

    public StudentRiskEvent {
        Objects.requireNonNull(studentId, "student_id is required");
        Objects.requireNonNull(score, "score is required");
        Objects.requireNonNull(severity, "severity is required");
        studentName = studentName == null ? "" : studentName;
    }

    @Override
    public MessageType type() {
        return MessageType.STUDENT_RISK;
    }
}
