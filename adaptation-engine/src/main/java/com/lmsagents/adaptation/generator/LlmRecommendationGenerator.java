package com.lmsagents.adaptation.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmsagents.common.exception.AgentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link RecommendationGenerator} backed by an OpenAI-compatible chat-completions API
 * (OpenRouter by default).
 *
 * <p>Fully non-blocking: the HTTP call is composed as a {@code Mono} chain with a hard
 * timeout. Every failure path, including a missing API key, completes with
 * {@link GenerationResult.Failed} so the adaptation worker can fall back to rule text.
 */
@Service
public class LlmRecommendationGenerator implements RecommendationGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmRecommendationGenerator.class);

    private static final String INSTRUCTOR_ROLE  = "You are an experienced teacher. Answer briefly and to the point.";
    private static final String ANALYST_ROLE  = "You are a learning-analytics assistant. Answer with JSON only.";

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final AiProperties properties;

    public LlmRecommendationGenerator(WebClient.Builder builder, ObjectMapper objectMapper, AiProperties properties) {
        this.client = builder
            .baseUrl(properties.baseUrl())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader("HTTP-Referer", "http://localhost:5000")
            .defaultHeader("X-Title", "LMS Agent Platform")
            .build();
        this.objectMapper = objectMapper;
        this.properties   = properties;
    }

    @Override
    public Mono<GenerationResult> generateRecommendation(RecommendationRequest request) {
        if (!properties.isEnabled()) {
            return Mono.just(GenerationResult.failed("no API key configured"));
        }
        String prompt = String.format(Locale.ROOT,
            "You are an AI assistant in a distance-learning system. "
                + "Student \"%s\" is studying the topic \"%s\". "
                + "Their current result is %.1f%% (%d of %d correct). "
                + "Write a short personalised recommendation (2-4 sentences) "
                + "with concrete steps to improve.",
            request.studentName(), request.topicTitle(), request.scorePct(),
            request.correctAnswers(), request.totalAnswers());

        return chat(INSTRUCTOR_ROLE, prompt, 0.7, 300)
            .map(GenerationResult::generated)
            .doOnSuccess(r -> log.debug("[Generator] Recommendation generated. topic={}", request.topicTitle()))
            .onErrorResume(e -> {
                log.warn("[Generator] Recommendation call failed. topic={} reason={}",
                         request.topicTitle(), e.getMessage());
                return Mono.just(GenerationResult.failed(reasonOf(e)));
            });
    }

    @Override
    public Mono<GenerationResult> analyzeErrorPatterns(AnalysisRequest request) {
        if (!properties.isEnabled()) {
            return Mono.just(GenerationResult.failed("no API key configured"));
        }
        String topicLines = request.topics().stream()
            .map(t -> String.format(Locale.ROOT, "- %s: %.1f%% (%d/%d)", t.topicTitle(), t.pct(), t.correct(), t.total()))
            .collect(Collectors.joining("\n"));
        String prompt = """
            Student "%s" has the following results:
            %s

            Analyse the error pattern. Identify the weak areas and suggest a difficulty level \
            (1=easy, 2=medium, 3=hard).

            Respond strictly with JSON:
            {"summary": "...", "weak_areas": ["..."], "suggested_difficulty": 1}
            """.formatted(request.studentName(), topicLines);

        return chat(ANALYST_ROLE, prompt, 0.5, 500)
            .map(GenerationResult::generated)
            .onErrorResume(e -> {
                log.warn("[Generator] Error-pattern analysis call failed. student={} reason={}",
                         request.studentName(), e.getMessage());
                return Mono.just(GenerationResult.failed(reasonOf(e)));
            });
    }

    // ── chat-completions call ────────────────────────────────────────────────

    private Mono<String> chat(String systemPrompt, String userPrompt, double temperature, int maxTokens) {
        Map<String, Object> requestBody = Map.of(
            "model", properties.model(),
            "temperature", temperature,
            "max_tokens", maxTokens,
            "messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey())
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(properties.timeout())
            )
            .map(this::extractContent);
    }

    private String extractContent(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new AgentException("Generator", AgentException.Fault.GENERATOR_RESPONSE,
                                     "Unreadable completion response", e);
        }
        String content = root.path("choices").path(0).path("message").path("content").asText("").strip();
        if (content.isEmpty()) {
            throw new AgentException("Generator", AgentException.Fault.GENERATOR_RESPONSE,
                                     "Completion response carried no text");
        }
        return content;
    }

    private static String reasonOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
