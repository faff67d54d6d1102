package com.cheflink.agent.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Bound from the {@code llm.*} block of application.yml.
 *
 * Only the provider named by {@code llm.provider} is instantiated; the others
 * may be left without an API key.
 */
@Data
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {

    /** groq | openai | gemini */
    private String provider = "groq";

    private LlmProviderProperties groq = provider("https://api.groq.com/openai/v1", "llama-3.3-70b-versatile");
    private LlmProviderProperties openai = provider("https://api.openai.com/v1", "gpt-4o-mini");
    private LlmProviderProperties gemini = provider(
            "https://generativelanguage.googleapis.com/v1beta/openai", "gemini-2.0-flash");

    private Http http = new Http();

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration responseTimeout = Duration.ofSeconds(60);
        private int maxConnections = 20;
    }

    public LlmProviderProperties active() {
        return switch (provider.toLowerCase()) {
            case "openai" -> openai;
            case "gemini" -> gemini;
            default -> groq;
        };
    }

    private static LlmProviderProperties provider(String baseUrl, String model) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setBaseUrl(baseUrl);
        p.setModel(model);
        return p;
    }
}
