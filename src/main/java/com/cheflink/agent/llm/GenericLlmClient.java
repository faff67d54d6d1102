package com.cheflink.agent.llm;

import com.cheflink.agent.exception.AgentException;
import com.cheflink.agent.model.Message;
import com.cheflink.agent.model.ModelCompletion;
import com.cheflink.agent.model.ToolCall;
import com.cheflink.agent.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions client (Groq, OpenAI, Gemini).
 *
 * Returns the raw completion; deciding between tool calls and a final answer
 * is the ResponseParser's job.
 *
 * | Error                    | Action                                          |
 * |--------------------------|-------------------------------------------------|
 * | 401 invalid key          | AgentException (not retried, not a CB failure)  |
 * | 400 model_decommissioned | AgentException with a configuration hint        |
 * | 400 tool_use_failed      | failed_generation returned as raw text          |
 * | 429                      | RuntimeException (retried)                      |
 * | other 4xx                | AgentException                                  |
 * | 5xx / network            | RuntimeException (retried, counts as failure)   |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient restClient;
    private final int maxTokens;

    public GenericLlmClient(LlmProviderProperties props,
                            ObjectMapper objectMapper,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this(props, objectMapper, providerName, restClientBuilder, null);
    }

    /**
     * @param maxTokensPerCall deployment cap on {@code max_tokens}; only applied
     *                         when lower than the provider's own setting
     */
    public GenericLlmClient(LlmProviderProperties props,
                            ObjectMapper objectMapper,
                            String providerName,
                            RestClient.Builder restClientBuilder,
                            Integer maxTokensPerCall) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.maxTokens = maxTokensPerCall != null
                ? Math.min(maxTokensPerCall, props.getMaxTokens()) : props.getMaxTokens();
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public ModelCompletion complete(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools);

        log.debug("Sending {} messages to {} [model={}]", messages.size(), providerName, props.getModel());

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw new RuntimeException(
                                providerName + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (ToolUseFailedException e) {
            return recoverFailedGeneration(e.getErrorBody());
        }
    }

    void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned")) {
            log.error("Model {} is decommissioned by {}; set llm.{}.model to a supported model",
                    props.getModel(), providerName, providerName);
            throw new AgentException("Model '" + props.getModel() + "' is decommissioned");
        }
        if (body.contains("tool_use_failed")) {
            throw new ToolUseFailedException(body);
        }
        if (statusCode == 401) {
            throw new AgentException(providerName + " API key is invalid. Check your "
                    + providerName.toUpperCase() + "_API_KEY environment variable.");
        }
        if (statusCode == 429) {
            throw new RuntimeException(providerName + " rate limit exceeded. Will retry.");
        }
        throw new AgentException(providerName + " client error [" + statusCode + "]: " + body);
    }

    /**
     * Some providers reject their own text-form tool call and echo it in
     * "failed_generation". Handing that text back lets the parser pick the
     * directive up like any other output.
     */
    @SuppressWarnings("unchecked")
    ModelCompletion recoverFailedGeneration(String errorBody) {
        String failedGeneration = null;
        try {
            Map<String, Object> errorMap = objectMapper.readValue(errorBody, new TypeReference<>() {});
            Object error = errorMap.get("error");
            if (error instanceof Map<?, ?> errorFields) {
                failedGeneration = (String) ((Map<String, Object>) errorFields).get("failed_generation");
            }
        } catch (JsonProcessingException e) {
            log.warn("Unreadable tool_use_failed body from {}: {}", providerName, e.getOriginalMessage());
        }

        if (failedGeneration == null) {
            log.warn("{} tool_use_failed without failed_generation", providerName);
            failedGeneration = "";
        } else {
            log.info("Recovered failed generation from {}: {}", providerName, failedGeneration);
        }
        return ModelCompletion.builder()
                .rawText(failedGeneration)
                .model(props.getModel())
                .build();
    }

    Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", maxTokens);
        body.put("temperature", props.getTemperature());
        body.put("messages", messages.stream().map(this::formatMessage).toList());

        if (tools != null && !tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }
        return body;
    }

    Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();

        switch (msg.getRole()) {
            case tool -> {
                m.put("role", "tool");
                m.put("tool_call_id", msg.getToolCallId());
                m.put("content", msg.getContent());
            }
            case assistant -> {
                m.put("role", "assistant");
                m.put("content", msg.getContent());
                if (msg.hasToolCalls()) {
                    m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
                }
            }
            // Compression summaries are ours, the wire only knows assistant
            case assistant_internal -> {
                m.put("role", "assistant");
                m.put("content", msg.getContent() != null ? msg.getContent() : "");
            }
            default -> {
                m.put("role", msg.getRole().name());
                m.put("content", msg.getContent() != null ? msg.getContent() : "");
            }
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getToolName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(
                    tc.getArguments() != null ? tc.getArguments() : Map.of()));
        } catch (JsonProcessingException e) {
            fn.put("arguments", "{}");
        }

        Map<String, Object> tcMap = new HashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");
        tcMap.put("function", fn);
        return tcMap;
    }

    @SuppressWarnings("unchecked")
    ModelCompletion parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new AgentException(providerName + " returned no choices in response");
        }

        int promptTokens = 0;
        int completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> choice = choices.get(0);
        Map<String, Object> message = (Map<String, Object>) choice.get("message");
        log.debug("{} finish_reason: {}", providerName, choice.get("finish_reason"));

        List<ToolCall> toolCalls = new ArrayList<>();
        List<Map<String, Object>> rawCalls = message != null
                ? (List<Map<String, Object>>) message.get("tool_calls") : null;
        if (rawCalls != null) {
            for (Map<String, Object> raw : rawCalls) {
                toolCalls.add(toToolCall(raw));
            }
        }

        return ModelCompletion.builder()
                .rawText(message != null ? (String) message.get("content") : null)
                .toolCalls(toolCalls)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .model((String) response.getOrDefault("model", props.getModel()))
                .build();
    }

    @SuppressWarnings("unchecked")
    private ToolCall toToolCall(Map<String, Object> raw) {
        Map<String, Object> function = (Map<String, Object>) raw.get("function");
        String argsJson = (String) function.get("arguments");

        Map<String, Object> args;
        try {
            args = argsJson == null || argsJson.isBlank()
                    ? new HashMap<>()
                    : objectMapper.readValue(argsJson, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            // Left to schema validation: the model gets a validation error back
            log.warn("Unparseable arguments for tool [{}]: {}", function.get("name"), argsJson);
            args = new HashMap<>();
        }

        return ToolCall.builder()
                .id((String) raw.get("id"))
                .toolName((String) function.get("name"))
                .arguments(args)
                .build();
    }

    private static class ToolUseFailedException extends RuntimeException {
        private final String errorBody;

        ToolUseFailedException(String errorBody) {
            super("tool_use_failed");
            this.errorBody = errorBody;
        }

        String getErrorBody() {
            return errorBody;
        }
    }
}
