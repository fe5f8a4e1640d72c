package com.lmsagents.adaptation.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmsagents.adaptation.generator.AnalysisRequest;
import com.lmsagents.adaptation.generator.GenerationResult;
import com.lmsagents.adaptation.generator.RecommendationGenerator;
import com.lmsagents.adaptation.generator.TopicResult;
import com.lmsagents.common.model.GeneratedBy;
import com.lmsagents.common.scoring.PerformanceCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns per-topic results into an {@link ErrorAnalysis}: asks the generator first and
 * falls back to local rules when it fails or returns something that is not the expected
 * JSON object.
 */
@Component
public class ErrorPatternAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ErrorPatternAnalyzer.class);

    static final double WEAK_TOPIC_BELOW = 50.0;
    static final double EASY_AVERAGE_BELOW = 60.0;

    private final RecommendationGenerator generator;
    private final ObjectMapper objectMapper;

    public ErrorPatternAnalyzer(RecommendationGenerator generator, ObjectMapper objectMapper) {
        this.generator    = generator;
        this.objectMapper = objectMapper;
    }

    /** Never empty, never errors. */
    public Mono<ErrorAnalysis> analyze(String studentName, List<TopicResult> topics) {
        return generator.analyzeErrorPatterns(new AnalysisRequest(studentName, topics))
            .map(result -> interpret(result, topics))
            .defaultIfEmpty(fallback(topics))
            .onErrorResume(e -> {
                log.warn("[ErrorAnalyzer] Generator misbehaved; using rule analysis. reason={}", e.getMessage());
                return Mono.just(fallback(topics));
            });
    }

    ErrorAnalysis interpret(GenerationResult result, List<TopicResult> topics) {
        if (result instanceof GenerationResult.Generated generated) {
            try {
                return parse(generated.text(), topics);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[ErrorAnalyzer] Unusable analysis output; using rule analysis. reason={}", e.getMessage());
                return fallback(topics);
            }
        }
        log.info("[ErrorAnalyzer] External analysis unavailable; using rule analysis. reason={}",
                 ((GenerationResult.Failed) result).reason());
        return fallback(topics);
    }

    private ErrorAnalysis parse(String raw, List<TopicResult> topics) throws JsonProcessingException {
        JsonNode json = objectMapper.readTree(stripFences(raw));
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("analysis is not a JSON object");
        }
        ErrorAnalysis rules = fallback(topics);

        String summary = json.path("summary").asText("").strip();
        List<String> weakAreas = new ArrayList<>();
        json.path("weak_areas").forEach(n -> weakAreas.add(n.asText()));
        int difficulty = json.path("suggested_difficulty").asInt(rules.suggestedDifficulty());

        return new ErrorAnalysis(
            summary.isEmpty() ? rules.summary() : summary,
            weakAreas,
            Math.max(1, Math.min(3, difficulty)),
            GeneratedBy.EXTERNAL);
    }

    /**
     * Rule analysis: topics under 50% are weak; difficulty 1 when the mean topic
     * percentage is under 60, else 2.
     */
    public static ErrorAnalysis fallback(List<TopicResult> topics) {
        List<String> weak = topics.stream()
            .filter(t -> t.pct() < WEAK_TOPIC_BELOW)
            .map(TopicResult::topicTitle)
            .toList();
        double average = topics.stream().mapToDouble(TopicResult::pct).average().orElse(0.0);
        int difficulty = average < EASY_AVERAGE_BELOW ? 1 : 2;

        String summary = String.format(Locale.ROOT, "Average score: %.1f%%. Weak topics: %s.",
            PerformanceCalculator.round1(average),
            weak.isEmpty() ? "none identified" : String.join(", ", weak));
        return new ErrorAnalysis(summary, weak, difficulty, GeneratedBy.RULE);
    }

    static String stripFences(String raw) {
        String text = raw.strip();
        if (text.startsWith("```")) {
            int newline = text.indexOf('\n');
            text = newline >= 0 ? text.substring(newline + 1) : text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.strip();
    }
}
