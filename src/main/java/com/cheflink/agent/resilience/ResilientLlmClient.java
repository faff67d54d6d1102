package com.cheflink.agent.resilience;

import com.cheflink.agent.exception.AgentException;
import com.cheflink.agent.exception.ModelUnavailableException;
import com.cheflink.agent.llm.LlmClient;
import com.cheflink.agent.model.Message;
import com.cheflink.agent.model.ModelCompletion;
import com.cheflink.agent.tool.ToolDefinition;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the active provider client that adds retry and a circuit breaker.
 *
 * Fallbacks raise {@link ModelUnavailableException} instead of inventing an
 * answer: a made-up reply would look like a model output to the parser.
 * Instances "llmClient" are configured in application.yml.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitBreakerFallback")
    public ModelCompletion complete(List<Message> messages, List<ToolDefinition> tools) {
        return delegate.complete(messages, tools);
    }

    public ModelCompletion retryFallback(List<Message> messages, List<ToolDefinition> tools, Exception ex) {
        rethrowIfNotTransient(ex);
        log.error("LLM call failed after all retries: {}", ex.getMessage());
        throw new ModelUnavailableException("Model provider unreachable after retries: " + ex.getMessage(), ex);
    }

    public ModelCompletion circuitBreakerFallback(List<Message> messages, List<ToolDefinition> tools, Exception ex) {
        rethrowIfNotTransient(ex);
        log.error("LLM circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        throw new ModelUnavailableException("Model provider circuit open: " + ex.getMessage(), ex);
    }

    /** Configuration and client errors keep their own type and message */
    private void rethrowIfNotTransient(Exception ex) {
        if (ex instanceof AgentException agentException) {
            throw agentException;
        }
    }
}
