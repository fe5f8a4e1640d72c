package com.lmsagents.adaptation;

import com.lmsagents.common.model.GeneratedBy;

import java.util.List;

/** What one {@code generate_recommendations} command produced. */
public record RecommendationOutcome(int count, boolean aiUsed) {

    public static final RecommendationOutcome NONE = new RecommendationOutcome(0, false);

    public static RecommendationOutcome of(List<GeneratedBy> persisted) {
        return new RecommendationOutcome(persisted.size(), persisted.contains(GeneratedBy.EXTERNAL));
    }
}
