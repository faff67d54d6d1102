package com.cheflink.agent.tool;

import com.cheflink.agent.model.ToolCall;
import com.cheflink.agent.model.ToolResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class ToolExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);
    private final ToolContext context = ToolContext.of("conv-1", "user-1");

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void execute_success_returnsPayload() {
        ToolExecutor executor = executor(4000, new StubTool("search_recipes", ToolCategory.RECIPE_SEARCH,
                args -> "found " + args.get("query")));

        ToolResult result = executor.execute(call("c1", "search_recipes", Map.of("query", "tofu")), context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCallId()).isEqualTo("c1");
        assertThat(result.toObservation()).isEqualTo("found tofu");
    }

    @Test
    void unknownTool_listsAvailableTools() {
        ToolExecutor executor = executor(4000, new StubTool("search_recipes", ToolCategory.RECIPE_SEARCH, args -> ""));

        ToolResult result = executor.execute(call("c1", "order_pizza", Map.of()), context);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ToolErrorKind.UNKNOWN_TOOL);
        assertThat(result.toObservation()).startsWith("ERROR [UnknownTool]").contains("search_recipes");
    }

    @Test
    void toolOutsideAllowedCategories_isUnknown() {
        ToolExecutor executor = executor(4000, new StubTool("search_recipes", ToolCategory.RECIPE_SEARCH, args -> "x"));
        ToolContext nutritionOnly = new ToolContext("conv-1", "user-1", Set.of(ToolCategory.NUTRITION));

        ToolResult result = executor.execute(call("c1", "search_recipes", Map.of("query", "x")), nutritionOnly);

        assertThat(result.getErrorKind()).isEqualTo(ToolErrorKind.UNKNOWN_TOOL);
    }

    @Test
    void invalidArguments_neverReachHandler() {
        boolean[] called = {false};
        ToolExecutor executor = executor(4000, new StubTool("search_recipes", ToolCategory.RECIPE_SEARCH, args -> {
            called[0] = true;
            return "";
        }));

        ToolResult result = executor.execute(call("c1", "search_recipes", Map.of("limit", "ten")), context);

        assertThat(called[0]).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ToolErrorKind.VALIDATION_ERROR);
        assertThat(result.getErrorMessage()).contains("missing required argument 'query'")
                .contains("argument 'limit' must be of type integer");
    }

    @Test
    void handlerException_becomesExecutionError() {
        ToolExecutor executor = executor(4000, new StubTool("search_recipes", ToolCategory.RECIPE_SEARCH, args -> {
            throw new IllegalArgumentException("catalog offline");
        }));

        ToolResult result = executor.execute(call("c1", "search_recipes", Map.of("query", "x")), context);

        assertThat(result.getErrorKind()).isEqualTo(ToolErrorKind.EXECUTION_ERROR);
        assertThat(result.toObservation()).isEqualTo("ERROR [ExecutionError]: Tool execution failed: catalog offline");
    }

    @Test
    void handlerError_singleCall_becomesExecutionError() {
        ToolExecutor executor = executor(4000, new StubTool("search_recipes", ToolCategory.RECIPE_SEARCH, args -> {
            throw new AssertionError("handler bug");
        }));

        List<ToolResult> results = executor.executeAll(
                List.of(call("c1", "search_recipes", Map.of("query", "x"))), context);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getErrorKind()).isEqualTo(ToolErrorKind.EXECUTION_ERROR);
        assertThat(results.get(0).getErrorMessage()).contains("handler bug");
    }

    @Test
    void handlerError_concurrentCalls_isNormalizedTheSameWay() {
        ToolExecutor executor = executor(4000,
                new StubTool("broken", ToolCategory.RECIPE_SEARCH, args -> {
                    throw new NoClassDefFoundError("com/example/Missing");
                }),
                new StubTool("fine", ToolCategory.RECIPE_SEARCH, args -> "ok"));

        List<ToolResult> results = executor.executeAll(List.of(
                call("a", "broken", Map.of("query", "x")),
                call("b", "fine", Map.of("query", "y"))), context);

        assertThat(results.get(0).getErrorKind()).isEqualTo(ToolErrorKind.EXECUTION_ERROR);
        assertThat(results.get(0).getErrorMessage()).isEqualTo("Tool execution failed: com/example/Missing");
        assertThat(results.get(1).getPayload()).isEqualTo("ok");
    }

    @Test
    void largePayload_isTruncatedWithMarker() {
        ToolExecutor executor = executor(10, new StubTool("search_recipes", ToolCategory.RECIPE_SEARCH,
                args -> "0123456789abcdef"));

        ToolResult result = executor.execute(call("c1", "search_recipes", Map.of("query", "x")), context);

        assertThat(result.isTruncated()).isTrue();
        assertThat(result.getOriginalLength()).isEqualTo(16);
        assertThat(result.getPayload()).isEqualTo("0123456789\n...[truncated 6 of 16 chars]");
    }

    @Test
    void executeAll_returnsResultsInCallOrder() {
        ToolExecutor executor = executor(4000, new StubTool("slow", ToolCategory.RECIPE_SEARCH, args -> {
            try {
                Thread.sleep(Long.parseLong((String) args.get("query")));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "slept " + args.get("query");
        }));

        List<ToolResult> results = executor.executeAll(List.of(
                call("a", "slow", Map.of("query", "150")),
                call("b", "slow", Map.of("query", "10")),
                call("c", "missing", Map.of())), context);

        assertThat(results).extracting(ToolResult::getCallId).containsExactly("a", "b", "c");
        assertThat(results.get(0).getPayload()).isEqualTo("slept 150");
        assertThat(results.get(2).isSuccess()).isFalse();
    }

    @Test
    void executeAll_empty_returnsEmpty() {
        ToolExecutor executor = executor(4000, new StubTool("x", ToolCategory.NUTRITION, args -> ""));

        assertThat(executor.executeAll(List.of(), context)).isEmpty();
    }

    private ToolExecutor executor(int maxPayload, AgentTool... tools) {
        return new ToolExecutor(ToolRegistry.of(List.of(tools)), pool, maxPayload);
    }

    private static ToolCall call(String id, String name, Map<String, Object> args) {
        return ToolCall.builder().id(id).toolName(name).arguments(args).build();
    }
}
