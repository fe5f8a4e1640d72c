package com.lmsagents.common.scoring;

import java.util.Locale;

/**
 * Deterministic recommendation text used whenever the external generator is unavailable.
 * Depends only on the score bucket (&lt; 30, 30–50, ≥ 50) and the topic title, so repeated
 * calls with the same inputs yield identical text.
 */
public final class FallbackRecommendations {

    private FallbackRecommendations() {}

    public static String text(String topicTitle, double scorePct) {
        String score = String.format(Locale.ROOT, "%.1f", scorePct);
        if (scorePct < 30) {
            return "Review the topic \"" + topicTitle + "\" from the very beginning. "
                + "The current result (" + score + "%) shows the material has not been absorbed yet. "
                + "Start with the theory, then move on to practice.";
        }
        if (scorePct < 50) {
            return "Review the topic \"" + topicTitle + "\" (current result: " + score + "%). "
                + "Pay attention to the explanations of the questions that caused difficulties.";
        }
        return "The result for the topic \"" + topicTitle + "\" is " + score + "%. "
            + "Retake the quiz to consolidate the material.";
    }
}
