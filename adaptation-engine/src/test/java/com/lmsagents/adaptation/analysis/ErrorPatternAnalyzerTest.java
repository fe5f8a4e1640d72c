package com.lmsagents.adaptation.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmsagents.adaptation.generator.AnalysisRequest;
import com.lmsagents.adaptation.generator.GenerationResult;
import com.lmsagents.adaptation.generator.RecommendationGenerator;
import com.lmsagents.adaptation.generator.RecommendationRequest;
import com.lmsagents.adaptation.generator.TopicResult;
import com.lmsagents.common.model.GeneratedBy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorPatternAnalyzerTest {

    private static final List<TopicResult> TOPICS = List.of(
        new TopicResult("Loops", 10, 2, 20.0),
        new TopicResult("Arrays", 10, 9, 90.0));

    private static ErrorPatternAnalyzer answering(GenerationResult result) {
        RecommendationGenerator generator = new RecommendationGenerator() {
            @Override
            public Mono<GenerationResult> generateRecommendation(RecommendationRequest request) {
                return Mono.just(GenerationResult.failed("unused"));
            }

            @Override
            public Mono<GenerationResult> analyzeErrorPatterns(AnalysisRequest request) {
                return Mono.just(result);
            }
        };
        return new ErrorPatternAnalyzer(generator, new ObjectMapper());
    }

    @Nested
    @DisplayName("external output")
    class External {

        @Test
        @DisplayName("fenced JSON is unwrapped and used")
        void fencedJson() {
            String raw = "```json\n{\"summary\":\"Weak on iteration\",\"weak_areas\":[\"Loops\"],\"suggested_difficulty\":2}\n```";
            ErrorAnalysis analysis = answering(GenerationResult.generated(raw)).analyze("Ivan", TOPICS).block();

            assertEquals("Weak on iteration", analysis.summary());
            assertEquals(List.of("Loops"), analysis.weakAreas());
            assertEquals(2, analysis.suggestedDifficulty());
            assertEquals(GeneratedBy.EXTERNAL, analysis.generatedBy());
        }

        @Test
        @DisplayName("out-of-range difficulty is clamped to 1..3")
        void clampsDifficulty() {
            String raw = "{\"summary\":\"x\",\"weak_areas\":[],\"suggested_difficulty\":7}";
            assertEquals(3, answering(GenerationResult.generated(raw)).analyze("Ivan", TOPICS).block().suggestedDifficulty());
        }

        @Test
        @DisplayName("prose instead of JSON → rule analysis")
        void unparseable() {
            ErrorAnalysis analysis = answering(GenerationResult.generated("The student is doing fine."))
                .analyze("Ivan", TOPICS).block();
            assertEquals(GeneratedBy.RULE, analysis.generatedBy());
        }

        @Test
        @DisplayName("a JSON array is not an analysis → rule analysis")
        void notAnObject() {
            ErrorAnalysis analysis = answering(GenerationResult.generated("[1,2]")).analyze("Ivan", TOPICS).block();
            assertEquals(GeneratedBy.RULE, analysis.generatedBy());
        }
    }

    @Nested
    @DisplayName("rule analysis")
    class Rules {

        @Test
        @DisplayName("topics under 50% are weak; average under 60 → difficulty 1")
        void weakTopicsAndEasyDifficulty() {
            ErrorAnalysis analysis = answering(GenerationResult.failed("disabled")).analyze("Ivan", TOPICS).block();

            assertEquals(List.of("Loops"), analysis.weakAreas());
            assertEquals(1, analysis.suggestedDifficulty());
            assertEquals("Average score: 55.0%. Weak topics: Loops.", analysis.summary());
        }

        @Test
        @DisplayName("average of 60 or more → difficulty 2")
        void mediumDifficulty() {
            ErrorAnalysis analysis = ErrorPatternAnalyzer.fallback(List.of(
                new TopicResult("Loops", 10, 6, 60.0), new TopicResult("Arrays", 10, 7, 70.0)));

            assertEquals(2, analysis.suggestedDifficulty());
            assertTrue(analysis.weakAreas().isEmpty());
            assertEquals("Average score: 65.0%. Weak topics: none identified.", analysis.summary());
        }

        @Test
        @DisplayName("no topics → average 0, difficulty 1")
        void noTopics() {
            ErrorAnalysis analysis = ErrorPatternAnalyzer.fallback(List.of());
            assertEquals(1, analysis.suggestedDifficulty());
            assertEquals("Average score: 0.0%. Weak topics: none identified.", analysis.summary());
        }
    }

    @Test
    @DisplayName("stripFences handles bare and language-tagged fences")
    void stripFences() {
        assertEquals("{}", ErrorPatternAnalyzer.stripFences("```\n{}\n```"));
        assertEquals("{}", ErrorPatternAnalyzer.stripFences("```json\n{}```"));
        assertEquals("{}", ErrorPatternAnalyzer.stripFences("  {}  "));
    }
}
