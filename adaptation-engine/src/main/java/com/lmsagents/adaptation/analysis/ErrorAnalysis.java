package com.lmsagents.adaptation.analysis;

import com.lmsagents.common.model.GeneratedBy;

import java.util.List;

/**
 * Result of an error-pattern analysis for one student.
 *
 * @param suggestedDifficulty 1 (easy) to 3 (hard)
 * @param generatedBy         whether the external generator or the local rules produced it
 */
public record ErrorAnalysis(
    String summary,
    List<String> weakAreas,
    int suggestedDifficulty,
    GeneratedBy generatedBy
) {
    public ErrorAnalysis {
        weakAreas = weakAreas == null ? List.of() : List.copyOf(weakAreas);
    }
}
