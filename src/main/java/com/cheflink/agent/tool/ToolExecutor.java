package com.cheflink.agent.tool;

import com.cheflink.agent.model.ToolCall;
import com.cheflink.agent.model.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Dispatches tool calls against the {@link ToolRegistry}.
 *
 * Never throws for a tool problem: unknown tools, bad arguments and handler
 * faults all come back as a failed {@link ToolResult} so the model can see
 * what went wrong and try again.
 *
 * Calls issued in the same iteration are independent, so {@link #executeAll}
 * runs them concurrently and hands results back in call order.
 */
@Slf4j
public class ToolExecutor {

    static final String TRUNCATION_MARKER = "\n...[truncated %d of %d chars]";

    private final ToolRegistry registry;
    private final Executor executor;
    private final int maxPayloadChars;

    public ToolExecutor(ToolRegistry registry, Executor executor, int maxPayloadChars) {
        this.registry = registry;
        this.executor = executor;
        this.maxPayloadChars = maxPayloadChars;
    }

    public ToolResult execute(ToolCall call, ToolContext context) {
        long start = System.nanoTime();

        Optional<AgentTool> found = registry.find(call.getToolName())
                .filter(t -> context.allows(t.getCategory()));
        if (found.isEmpty()) {
            String msg = String.format("Unknown tool '%s'. Available tools: %s",
                    call.getToolName(), registry.exportSchema(context.allowedCategories()).stream()
                            .map(ToolDefinition::getName).toList());
            log.warn("{} [conversationId={}]", msg, context.conversationId());
            return ToolResult.failure(call, ToolErrorKind.UNKNOWN_TOOL, msg, elapsedMs(start));
        }

        AgentTool tool = found.get();
        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();

        List<String> violations = ToolSchemaValidator.validate(tool.getInputSchema(), arguments);
        if (!violations.isEmpty()) {
            String msg = "Invalid arguments for '" + tool.getName() + "': " + String.join("; ", violations);
            log.info("{} [conversationId={}]", msg, context.conversationId());
            return ToolResult.failure(call, ToolErrorKind.VALIDATION_ERROR, msg, elapsedMs(start));
        }

        log.info("Executing tool: [{}] with args: {} [conversationId={}]",
                tool.getName(), arguments, context.conversationId());

        String payload;
        try {
            payload = tool.execute(arguments, context);
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable e) {
            // handler bugs (AssertionError, NoClassDefFoundError, ...) are tool faults too
            log.error("Tool [{}] failed [conversationId={}]", tool.getName(), context.conversationId(), e);
            String msg = "Tool execution failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return ToolResult.failure(call, ToolErrorKind.EXECUTION_ERROR, msg, elapsedMs(start));
        }

        String text = payload != null ? payload : "";
        boolean truncated = text.length() > maxPayloadChars;
        if (truncated) {
            log.debug("Tool [{}] payload truncated from {} to {} chars",
                    tool.getName(), text.length(), maxPayloadChars);
        }

        return ToolResult.builder()
                .callId(call.getId())
                .toolName(tool.getName())
                .success(true)
                .payload(truncated ? truncate(text) : text)
                .truncated(truncated)
                .originalLength(text.length())
                .durationMs(elapsedMs(start))
                .build();
    }

    /**
     * Runs every call of one iteration concurrently.
     *
     * @return one result per call, index-aligned with {@code calls}
     */
    public List<ToolResult> executeAll(List<ToolCall> calls, ToolContext context) {
        if (calls.isEmpty()) {
            return List.of();
        }
        if (calls.size() == 1) {
            return List.of(execute(calls.get(0), context));
        }

        List<CompletableFuture<ToolResult>> futures = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            futures.add(submit(call, context));
        }

        List<ToolResult> results = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            results.add(await(futures.get(i), calls.get(i)));
        }
        return results;
    }

    private CompletableFuture<ToolResult> submit(ToolCall call, ToolContext context) {
        try {
            return CompletableFuture.supplyAsync(() -> execute(call, context), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Tool pool rejected [{}], running on caller thread", call.getToolName());
            return CompletableFuture.completedFuture(execute(call, context));
        }
    }

    private ToolResult await(CompletableFuture<ToolResult> future, ToolCall call) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Async execution of tool [{}] failed", call.getToolName(), cause);
            return ToolResult.failure(call, ToolErrorKind.EXECUTION_ERROR,
                    "Tool execution failed: " + cause.getMessage(), 0);
        }
    }

    private String truncate(String text) {
        int dropped = text.length() - maxPayloadChars;
        return text.substring(0, maxPayloadChars) + String.format(TRUNCATION_MARKER, dropped, text.length());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
