package com.lmsagents.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Router → Adaptation: run an error-pattern analysis for one student. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzeErrorsCommand(
    @JsonProperty("student_id")   Long studentId,
    @JsonProperty("student_name") String studentName
) implements AgentMessage {

    public AnalyzeErrorsCommand {
        Objects.requireNonNull(studentId, "student_id is required");
        studentName = studentName == null ? "" : studentName;
    }

    @Override
    public MessageType type() {
        return MessageType.ANALYZE_ERRORS;
    }
}
