package com.cheflink.agent.core;

import com.cheflink.agent.model.ModelCompletion;
import com.cheflink.agent.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw model output into tool calls, a final answer, or neither.
 *
 * Terminal form: the literal <code>{{final_message:</code> marker. The first
 * occurrence wins; text before it is reasoning, the rest of the output is the
 * answer. The marker takes priority over any tool call in the same output.
 *
 * Tool calls come from the provider's structured list and from directives
 * embedded in the text, in the form some OpenAI-compatible providers fall back to:
 * <pre>
 *   &lt;function=search_recipes{"query": "chicken"}&gt;&lt;/function&gt;
 *   &lt;function=search_recipes({"query": "chicken"})&lt;/function&gt;
 * </pre>
 */
@Slf4j
public class ResponseParser {

    public static final String FINAL_MESSAGE_MARKER = "{{final_message:";
    private static final String MARKER_CLOSE = "}}";

    private static final Pattern TEXT_TOOL_PATTERN =
            Pattern.compile("<function=(\\w+)\\(?(\\{.*?\\})\\)?(?:>?</function>|>)", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public ResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedResponse parse(String rawText) {
        return parse(ModelCompletion.builder().rawText(rawText).build());
    }

    public ParsedResponse parse(ModelCompletion completion) {
        String text = completion.getRawText() != null ? completion.getRawText() : "";

        int markerAt = text.indexOf(FINAL_MESSAGE_MARKER);
        if (markerAt >= 0) {
            String reasoning = text.substring(0, markerAt);
            String answer = extractPayload(text.substring(markerAt + FINAL_MESSAGE_MARKER.length()));
            if (!answer.isEmpty()) {
                if (completion.hasStructuredToolCalls() || TEXT_TOOL_PATTERN.matcher(reasoning).find()) {
                    log.debug("Final message marker present; discarding tool calls in the same output");
                }
                return ParsedResponse.finalMessage(answer, reasoning);
            }
            log.debug("Final message marker with empty payload");
        }

        List<ToolCall> calls = new ArrayList<>();
        if (completion.hasStructuredToolCalls()) {
            calls.addAll(completion.getToolCalls());
        }
        calls.addAll(extractTextToolCalls(text));

        if (!calls.isEmpty()) {
            return ParsedResponse.toolCalls(assignIds(calls), stripDirectives(text));
        }
        return ParsedResponse.inconclusive(text);
    }

    /**
     * Payload runs to end of output. A closing "}}" at the very end is dropped and
     * surrounding whitespace trimmed; inner newlines are kept as authored.
     */
    private String extractPayload(String afterMarker) {
        String payload = afterMarker.stripTrailing();
        if (payload.endsWith(MARKER_CLOSE)) {
            payload = payload.substring(0, payload.length() - MARKER_CLOSE.length());
        }
        return payload.strip();
    }

    private List<ToolCall> extractTextToolCalls(String text) {
        List<ToolCall> calls = new ArrayList<>();
        Matcher matcher = TEXT_TOOL_PATTERN.matcher(text);
        while (matcher.find()) {
            String toolName = matcher.group(1);
            String argsJson = matcher.group(2);
            try {
                Map<String, Object> args = objectMapper.readValue(argsJson, new TypeReference<>() {});
                calls.add(ToolCall.builder().toolName(toolName).arguments(args).build());
            } catch (JsonProcessingException e) {
                log.warn("Ignoring malformed tool directive for [{}]: {}", toolName, e.getOriginalMessage());
            }
        }
        return calls;
    }

    private List<ToolCall> assignIds(List<ToolCall> calls) {
        Set<String> seen = new HashSet<>();
        List<ToolCall> normalized = new ArrayList<>(calls.size());
        int n = 0;
        for (ToolCall call : calls) {
            n++;
            String id = call.getId();
            if (id == null || id.isBlank() || !seen.add(id)) {
                id = nextFreeId(seen, n);
            }
            normalized.add(call.toBuilder()
                    .id(id)
                    .arguments(call.getArguments() != null ? call.getArguments() : new HashMap<>())
                    .build());
        }
        return normalized;
    }

    private String nextFreeId(Set<String> seen, int n) {
        String id = "call_" + n;
        while (!seen.add(id)) {
            id = id + "_";
        }
        return id;
    }

    private String stripDirectives(String text) {
        return TEXT_TOOL_PATTERN.matcher(text).replaceAll("").strip();
    }
}
