package com.lmsagents.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Adaptation → Router: result of an error-pattern analysis. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdaptationAnalysisEvent(
    @JsonProperty("student_id")           Long studentId,
    @JsonProperty("suggested_difficulty") Integer suggestedDifficulty,
    @JsonProperty("summary")              String summary,
    @JsonProperty("weak_areas")           List<String> weakAreas
) implements AgentMessage {

    public AdaptationAnalysisEvent {
        Objects.requireNonNull(suggestedDifficulty, "suggested_difficulty is required");
        summary = summary == null ? "" : summary;
        weakAreas = weakAreas == null ? List.of() : List.copyOf(weakAreas);
    }

    @Override
    public MessageType type() {
        return MessageType.ADAPTATION_ANALYSIS;
    }
}
