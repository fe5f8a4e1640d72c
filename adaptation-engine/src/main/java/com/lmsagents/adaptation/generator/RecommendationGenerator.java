package com.lmsagents.adaptation.generator;

import reactor.core.publisher.Mono;

/**
 * External text generator used by the adaptation worker.
 *
 * <p>Implementations may be slow or unavailable. They must complete with exactly one
 * {@link GenerationResult}: missing credentials, transport errors, timeouts and blank
 * output are all reported as {@link GenerationResult.Failed}, never as an error signal.
 */
public interface RecommendationGenerator {

    /** Free-text advice for one student on one topic. */
    Mono<GenerationResult> generateRecommendation(RecommendationRequest request);

    /**
     * Raw analysis of a student's error pattern. A {@link GenerationResult.Generated} result
     * is expected to carry a JSON object with {@code summary}, {@code weak_areas} and
     * {@code suggested_difficulty}; the caller validates it.
     */
    Mono<GenerationResult> analyzeErrorPatterns(AnalysisRequest request);
}
