package com.lmsagents.adaptation.generator;

import java.time.Duration;

/**
 * Connection settings for the OpenAI-compatible chat-completions endpoint.
 * A blank {@code apiKey} disables external generation entirely.
 */
public record AiProperties(
    String apiKey,
    String baseUrl,
    String model,
    Duration timeout
) {
    public static final String DEFAULT_BASE_URL = "https://openrouter.ai/api/v1";
    public static final String DEFAULT_MODEL = "openai/gpt-4o-mini";

    public AiProperties {
        apiKey = apiKey == null ? "" : apiKey.strip();
        baseUrl = baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl;
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
        timeout = timeout == null ? Duration.ofSeconds(15) : timeout;
    }

    public static AiProperties disabled() {
        return new AiProperties("", DEFAULT_BASE_URL, DEFAULT_MODEL, Duration.ofSeconds(15));
    }

    public boolean isEnabled() {
        return !apiKey.isEmpty();
    }
}
