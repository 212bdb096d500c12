package com.deepansh.billbot.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Config for the OpenAI-compatible text-generation API (OpenAI, OpenRouter, Groq...).
 * Bound from application.yml under the "llm" prefix.
 */
@Component
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProviderProperties {
    private String apiKey = "";
    private String baseUrl = "https://openrouter.ai/api/v1";
    private String model = "anthropic/claude-3.5-sonnet";
    private int maxTokens = 2000;
    private double temperature = 0.3;
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(60);
    private int maxConnections = 20;

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
