package com.lmsagents.adaptation.config;

import com.lmsagents.adaptation.generator.AiProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AdaptationConfig {

    @Value("${lms.ai.api-key:}")
    private String apiKey;

    @Value("${lms.ai.base-url:" + AiProperties.DEFAULT_BASE_URL + "}")
    private String baseUrl;

    @Value("${lms.ai.model:" + AiProperties.DEFAULT_MODEL + "}")
    private String model;

    @Value("${lms.ai.timeout:15s}")
    private Duration timeout;

    @Bean
    public AiProperties aiProperties() {
        return new AiProperties(apiKey, baseUrl, model, timeout);
    }
}
