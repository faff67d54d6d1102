package com.cheflink.agent.llm;

import com.cheflink.agent.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw client for the provider selected by {@code llm.provider}.
 * Callers get it wrapped by ResilientLlmClient.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(LlmProperties llmProperties,
                                     AgentProperties agentProperties,
                                     ObjectMapper objectMapper,
                                     RestClient.Builder builder) {
        String provider = llmProperties.getProvider().toLowerCase();
        LlmProviderProperties props = llmProperties.active();

        log.info("Active LLM provider: {} [model={}, baseUrl={}]",
                provider.toUpperCase(), props.getModel(), props.getBaseUrl());
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            log.error("No API key configured for {}. Set {}_API_KEY; model calls will fail with 401.",
                    provider, provider.toUpperCase());
        }
        return new GenericLlmClient(props, objectMapper, provider, builder.clone(),
                agentProperties.getBudget().getMaxTokensPerCall());
    }
}
