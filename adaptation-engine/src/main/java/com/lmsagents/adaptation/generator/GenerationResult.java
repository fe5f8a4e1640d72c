package com.lmsagents.adaptation.generator;

/**
 * Outcome of one call to a {@link RecommendationGenerator}. Callers decide what a
 * {@link Failed} result falls back to; a generator never throws instead of returning one.
 */
public sealed interface GenerationResult permits GenerationResult.Generated, GenerationResult.Failed {

    record Generated(String text) implements GenerationResult {}

    record Failed(String reason) implements GenerationResult {}

    static GenerationResult generated(String text) {
        return new Generated(text);
    }

    static GenerationResult failed(String reason) {
        return new Failed(reason);
    }
}
