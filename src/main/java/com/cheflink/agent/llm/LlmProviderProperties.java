package com.cheflink.agent.llm;

import lombok.Data;

/**
 * Connection settings for one OpenAI-compatible provider.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens = 1024;
    private double temperature = 0.2;
}
