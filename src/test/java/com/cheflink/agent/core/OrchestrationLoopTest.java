package com.cheflink.agent.core;

import com.cheflink.agent.exception.ModelUnavailableException;
import com.cheflink.agent.llm.LlmClient;
import com.cheflink.agent.model.AgentRequest;
import com.cheflink.agent.model.AgentResponse;
import com.cheflink.agent.model.Message;
import com.cheflink.agent.model.ModelCompletion;
import com.cheflink.agent.model.ToolCall;
import com.cheflink.agent.model.ToolResult;
import com.cheflink.agent.observability.IterationRecord;
import com.cheflink.agent.observability.TerminationReason;
import com.cheflink.agent.observability.Trace;
import com.cheflink.agent.tool.AgentTool;
import com.cheflink.agent.tool.ToolCategory;
import com.cheflink.agent.tool.ToolContext;
import com.cheflink.agent.tool.ToolDefinition;
import com.cheflink.agent.tool.ToolErrorKind;
import com.cheflink.agent.tool.ToolExecutor;
import com.cheflink.agent.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OrchestrationLoopTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Trace> traces = new CopyOnWriteArrayList<>();
    private final TokenEstimator estimator = new CharacterTokenEstimator();

    private ExecutorService modelExecutor;
    private ExecutorService toolPool;
    private MutableClock clock;
    private ScriptedLlm llm;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        modelExecutor = Executors.newCachedThreadPool();
        toolPool = Executors.newFixedThreadPool(4);
        clock = new MutableClock();
        llm = new ScriptedLlm();
        registry = ToolRegistry.builder()
                .register(new RecipeSearchStub())
                .register(new DelayedEchoTool())
                .build();
    }

    @AfterEach
    void tearDown() {
        modelExecutor.shutdownNow();
        toolPool.shutdownNow();
    }

    // --- scenarios ------------------------------------------------------------

    @Test
    void immediateFinalMessage_endsAfterOneIteration() {
        llm.reply("{{final_message: Hi there!}}");

        AgentResponse response = loop(defaults()).run(request("Hello"));

        assertThat(response.getFinalAnswer()).isEqualTo("Hi there!");
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FINAL_MESSAGE);
        assertThat(response.getIterationsUsed()).isEqualTo(1);
        assertThat(response.getToolCallsExecuted()).isEmpty();

        Trace trace = singleTrace();
        assertThat(trace.getIterations()).hasSize(1);
        assertThat(trace.toolCallCount()).isZero();
        assertThat(trace.getFinalAnswer()).isEqualTo("Hi there!");
        assertThat(trace.getTerminationReason()).isEqualTo(TerminationReason.FINAL_MESSAGE);
        assertThat(trace.getStateTransitions()).containsExactly(
                "INIT->AWAITING_MODEL", "AWAITING_MODEL->PARSING", "PARSING->TERMINATED");
    }

    @Test
    void toolCallThenFinal_recordsTwoIterationsAndOneSuccessfulResult() {
        llm.reply("<function=search_recipes{\"query\": \"chicken\"}></function>");
        llm.reply("{{final_message: Found 3 chicken recipes.}}");

        AgentResponse response = loop(defaults()).run(request("Find chicken recipes"));

        assertThat(response.getFinalAnswer()).isEqualTo("Found 3 chicken recipes.");
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FINAL_MESSAGE);
        assertThat(response.getToolCallsExecuted()).extracting(ToolCall::getToolName)
                .containsExactly("search_recipes");

        Trace trace = singleTrace();
        assertThat(trace.getIterations()).hasSize(2);
        assertThat(trace.toolCallCount()).isEqualTo(1);
        ToolResult result = trace.getIterations().get(0).getToolResults().get(0);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPayload()).contains("3 recipes for chicken");

        // Second model call sees the assistant tool-call echo and the tool observation
        List<Message> second = llm.snapshots.get(1);
        assertThat(second).extracting(Message::getRole).containsExactly(
                Message.Role.system, Message.Role.user, Message.Role.assistant, Message.Role.tool);
        assertThat(second.get(3).getToolCallId()).isEqualTo(second.get(2).getToolCalls().get(0).getId());
    }

    @Test
    void modelNeverFinishes_stopsAtIterationLimitWithoutExtraCall() {
        llm.always(snapshot -> completion("<function=search_recipes{\"query\": \"beef\"}>"));

        AgentResponse response = loop(defaults()).run(request("Plan my week"));

        assertThat(llm.calls()).isEqualTo(20);
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.ITERATION_LIMIT);
        assertThat(response.getIterationsUsed()).isEqualTo(20);
        assertThat(response.isBudgetExhausted()).isTrue();
        assertThat(response.getFinalAnswer()).startsWith("Partial result").contains("iteration limit");
        assertThat(singleTrace().getIterations()).hasSize(20);
    }

    @Test
    void missingRequiredArgument_feedsValidationErrorBackAndContinues() {
        llm.reply("<function=search_recipes{}>");
        llm.reply("{{final_message: Which ingredient?}}");

        AgentResponse response = loop(defaults()).run(request("Find something"));

        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FINAL_MESSAGE);
        assertThat(response.getIterationsUsed()).isEqualTo(2);

        ToolResult result = singleTrace().getIterations().get(0).getToolResults().get(0);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo(ToolErrorKind.VALIDATION_ERROR);

        Message observation = last(llm.snapshots.get(1));
        assertThat(observation.getRole()).isEqualTo(Message.Role.tool);
        assertThat(observation.getContent()).startsWith("ERROR [ValidationError]").contains("query");
    }

    @Test
    void costCrossesLimit_stopsBeforeNextModelCall() {
        llm.always(snapshot -> ModelCompletion.builder()
                .rawText("<function=search_recipes{\"query\": \"tofu\"}>")
                .reportedCost(0.20)
                .build());

        AgentResponse response = loop(defaults()).run(request("Expensive question"));

        assertThat(llm.calls()).isEqualTo(3);
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.COST_LIMIT);
        assertThat(singleTrace().getTotalCost()).isCloseTo(0.60, within(1e-9));
    }

    // --- budget, mode ---------------------------------------------------------

    @Test
    void wallTimeExhausted_stopsWithTimeLimit() {
        llm.always(snapshot -> {
            clock.advance(Duration.ofSeconds(25));
            return completion("<function=search_recipes{\"query\": \"eggs\"}>");
        });

        AgentResponse response = loop(defaults()).run(request("Slow question"));

        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.TIME_LIMIT);
        assertThat(llm.calls()).isEqualTo(3);
    }

    @Test
    void directMode_singleModelCallThenFallback() {
        llm.always(snapshot -> completion("<function=search_recipes{\"query\": \"pasta\"}>"));

        AgentResponse response = loop(defaults().toBuilder().maxIterations(1).build()).run(request("Pasta?"));

        assertThat(llm.calls()).isEqualTo(1);
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.ITERATION_LIMIT);
        assertThat(response.getFinalAnswer()).contains("1 tool call(s)");
    }

    @Test
    void directMode_plainTextReplyIsTheAnswer() {
        llm.reply("Roast some vegetables with chickpeas.\n");

        AgentResponse response = loop(defaults().toBuilder().maxIterations(1).build()).run(request("Quick dinner?"));

        assertThat(llm.calls()).isEqualTo(1);
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FINAL_MESSAGE);
        assertThat(response.getFinalAnswer()).isEqualTo("Roast some vegetables with chickpeas.");
        assertThat(singleTrace().getIterations().get(0).getOutcome())
                .isEqualTo(IterationRecord.Outcome.FINAL_MESSAGE);
    }

    @Test
    void directMode_blankReplyStillFails() {
        llm.reply("   ");

        AgentResponse response = loop(defaults().toBuilder().maxIterations(1).build()).run(request("Quick dinner?"));

        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.ITERATION_LIMIT);
        assertThat(response.getFinalAnswer()).startsWith("Partial result");
    }

    // --- parsing ---------------------------------------------------------------

    @Test
    void reasoningBeforeMarker_neverReachesTheUser() {
        llm.reply("The user seems tired, keep it short. {{final_message: Try the stir fry.}}");

        AgentResponse response = loop(defaults()).run(request("Dinner idea?"));

        assertThat(response.getFinalAnswer()).isEqualTo("Try the stir fry.");
        IterationRecord iteration = singleTrace().getIterations().get(0);
        assertThat(iteration.getInternalReasoning()).contains("keep it short");
        assertThat(iteration.getRawModelOutput()).contains("{{final_message:");
    }

    @Test
    void inconclusiveOutput_getsCorrectiveNoteThenRecovers() {
        llm.reply("Let me think about that.");
        llm.reply("{{final_message: Salmon it is.}}");

        AgentResponse response = loop(defaults()).run(request("Fish?"));

        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FINAL_MESSAGE);
        List<Message> second = llm.snapshots.get(1);
        assertThat(second.get(second.size() - 2).getContent()).isEqualTo("Let me think about that.");
        assertThat(last(second).getRole()).isEqualTo(Message.Role.system);
        assertThat(last(second).getContent()).contains(ResponseParser.FINAL_MESSAGE_MARKER);
    }

    @Test
    void repeatedInconclusiveOutput_isFatal() {
        llm.always(snapshot -> completion("hmm"));

        AgentResponse response = loop(defaults()).run(request("?"));

        assertThat(llm.calls()).isEqualTo(3);
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FATAL_ERROR);
        assertThat(response.getFinalAnswer()).isEqualTo(OrchestrationLoop.FAILURE_ANSWER);
        assertThat(singleTrace().getErrorMessage()).contains("3 attempts");
    }

    @Test
    void messages_areStampedFromTheLoopClock() {
        llm.reply("<function=search_recipes{\"query\": \"kale\"}>");
        llm.reply("{{final_message: Kale salad.}}");

        loop(defaults()).run(request("Kale"));

        assertThat(llm.snapshots.get(1)).extracting(Message::getTimestamp)
                .containsOnly(MutableClock.START);
    }

    // --- tools -----------------------------------------------------------------

    @Test
    void concurrentToolCalls_appendResultsInCallOrder() {
        llm.reply(ModelCompletion.builder()
                .toolCalls(List.of(
                        call("slow", "delayed_echo", Map.of("text", "first", "delay_ms", 200)),
                        call("fast", "delayed_echo", Map.of("text", "second", "delay_ms", 0))))
                .build());
        llm.reply("{{final_message: done}}");

        loop(defaults()).run(request("Echo twice"));

        List<Message> toolMessages = llm.snapshots.get(1).stream()
                .filter(m -> m.getRole() == Message.Role.tool)
                .toList();
        assertThat(toolMessages).extracting(Message::getToolCallId).containsExactly("slow", "fast");
        assertThat(toolMessages).extracting(Message::getContent).containsExactly("first", "second");
    }

    @Test
    void unknownTool_isReportedToModel() {
        llm.reply("<function=order_groceries{\"item\": \"milk\"}>");
        llm.reply("{{final_message: I cannot order groceries.}}");

        AgentResponse response = loop(defaults()).run(request("Order milk"));

        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FINAL_MESSAGE);
        assertThat(last(llm.snapshots.get(1)).getContent()).startsWith("ERROR [UnknownTool]");
    }

    @Test
    void disallowedCategory_isHiddenAndRejected() {
        llm.reply("<function=search_recipes{\"query\": \"rice\"}>");
        llm.reply("{{final_message: ok}}");

        loop(defaults().toBuilder().allowedCategories(Set.of(ToolCategory.NUTRITION)).build())
                .run(request("Rice"));

        assertThat(llm.toolsOffered.get(0)).isEmpty();
        assertThat(last(llm.snapshots.get(1)).getContent()).startsWith("ERROR [UnknownTool]");
    }

    // --- model failures --------------------------------------------------------

    @Test
    void modelTimeout_isAbandonedAndRetriedWithUnchangedContext() {
        llm.reply(snapshot -> sleepThenAnswer(5_000));
        llm.reply("{{final_message: Back again.}}");

        AgentResponse response = loop(fastTimeouts()).run(request("Hi"));

        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FINAL_MESSAGE);
        assertThat(response.getIterationsUsed()).isEqualTo(2);
        assertThat(llm.snapshots.get(1)).hasSameSizeAs(llm.snapshots.get(0));
        assertThat(singleTrace().getIterations().get(0).getOutcome())
                .isEqualTo(IterationRecord.Outcome.MODEL_TIMEOUT);
    }

    @Test
    void tooManyConsecutiveTimeouts_isFatal() {
        llm.always(snapshot -> sleepThenAnswer(5_000));

        AgentResponse response = loop(fastTimeouts()).run(request("Hi"));

        assertThat(llm.calls()).isEqualTo(3);
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FATAL_ERROR);
        assertThat(response.getFinalAnswer()).isEqualTo(OrchestrationLoop.FAILURE_ANSWER);
    }

    @Test
    void modelUnavailable_isFatalAndStillTraced() {
        llm.always(snapshot -> {
            throw new ModelUnavailableException("circuit open", null);
        });

        AgentResponse response = loop(defaults()).run(request("Hi"));

        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FATAL_ERROR);
        assertThat(singleTrace().getErrorMessage()).contains("circuit open");
    }

    @Test
    void contextThatCannotBeCompressed_isFatalBeforeAnyModelCall() {
        LoopSettings tiny = defaults().toBuilder()
                .contextMaxTokens(20)
                .systemPrompt("x".repeat(200))
                .build();

        AgentResponse response = loop(tiny).run(request("Hi"));

        assertThat(llm.calls()).isZero();
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FATAL_ERROR);
        assertThat(singleTrace().getErrorMessage()).contains("tokens");
    }

    @Test
    void longRun_compressesHistoryAndKeepsGoing() {
        LoopSettings small = defaults().toBuilder().contextMaxTokens(400).retainRecent(2).build();
        llm.reply("<function=delayed_echo{\"text\": \"" + "a".repeat(400) + "\"}>");
        llm.reply("<function=delayed_echo{\"text\": \"" + "b".repeat(400) + "\"}>");
        llm.reply("<function=delayed_echo{\"text\": \"" + "c".repeat(400) + "\"}>");
        llm.reply("{{final_message: compressed fine}}");

        AgentResponse response = loop(small).run(request("Long task"));

        assertThat(response.getFinalAnswer()).isEqualTo("compressed fine");
        assertThat(llm.snapshots.get(3))
                .anyMatch(m -> m.getRole() == Message.Role.assistant_internal);
        assertThat(llm.snapshots.get(3).get(0).getRole()).isEqualTo(Message.Role.system);
    }

    // --- cancellation, sink, replay -------------------------------------------

    @Test
    void cancelledBeforeStart_makesNoModelCall() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        AgentResponse response = loop(defaults()).run(request("Hi"), token);

        assertThat(llm.calls()).isZero();
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FATAL_ERROR);
        assertThat(singleTrace().getErrorMessage()).isEqualTo("cancelled");
    }

    @Test
    void cancelledMidRun_stopsAtNextIterationBoundary() {
        CancellationToken token = new CancellationToken();
        llm.always(snapshot -> {
            token.cancel();
            return completion("<function=search_recipes{\"query\": \"soup\"}>");
        });

        AgentResponse response = loop(defaults()).run(request("Soup"), token);

        assertThat(llm.calls()).isEqualTo(1);
        assertThat(response.getIterationsUsed()).isEqualTo(1);
        assertThat(response.getToolCallsExecuted()).hasSize(1);
        assertThat(response.getTerminationReason()).isEqualTo(TerminationReason.FATAL_ERROR);
    }

    @Test
    void failingTraceSink_doesNotAffectTheAnswer() {
        llm.reply("{{final_message: still here}}");
        OrchestrationLoop loop = new OrchestrationLoop(llm, registry,
                new ToolExecutor(registry, toolPool, 4000), new ResponseParser(objectMapper),
                trace -> {
                    throw new IllegalStateException("sink down");
                },
                new CostCalculator(0.015, 0.075), new ExtractiveContextSummarizer(), estimator,
                modelExecutor, clock, defaults());

        assertThat(loop.run(request("Hi")).getFinalAnswer()).isEqualTo("still here");
    }

    @Test
    void sameScript_producesSameIterationsAndAnswer() {
        Function<List<Message>, ModelCompletion> script = snapshot -> snapshot.size() < 4
                ? completion("<function=search_recipes{\"query\": \"lentils\"}>")
                : completion("{{final_message: Lentil soup.}}");
        llm.always(script);
        AgentResponse first = loop(defaults()).run(request("Lentils", "conv-1"));

        ScriptedLlm replay = new ScriptedLlm();
        replay.always(script);
        llm = replay;
        AgentResponse second = loop(defaults()).run(request("Lentils", "conv-2"));

        assertThat(second.getFinalAnswer()).isEqualTo(first.getFinalAnswer());
        assertThat(second.getIterationsUsed()).isEqualTo(first.getIterationsUsed());
        assertThat(traces.get(1).getIterations()).extracting(IterationRecord::getOutcome)
                .containsExactlyElementsOf(traces.get(0).getIterations().stream().map(IterationRecord::getOutcome).toList());
    }

    @Test
    void costFromTokenUsage_isAccumulatedInTrace() {
        llm.reply(ModelCompletion.builder()
                .rawText("{{final_message: cheap}}")
                .promptTokens(1000)
                .completionTokens(1000)
                .build());

        loop(defaults()).run(request("Hi"));

        assertThat(singleTrace().getTotalCost()).isCloseTo(0.09, within(1e-9));
    }

    // --- helpers ---------------------------------------------------------------

    private OrchestrationLoop loop(LoopSettings settings) {
        return new OrchestrationLoop(llm, registry,
                new ToolExecutor(registry, toolPool, 4000),
                new ResponseParser(objectMapper),
                traces::add,
                new CostCalculator(0.015, 0.075),
                new ExtractiveContextSummarizer(),
                estimator,
                modelExecutor,
                clock,
                settings);
    }

    private static LoopSettings defaults() {
        return LoopSettings.builder().systemPrompt("You plan meals.").build();
    }

    private static LoopSettings fastTimeouts() {
        return defaults().toBuilder().modelCallTimeout(Duration.ofMillis(100)).maxModelTimeouts(2).build();
    }

    private static AgentRequest request(String input) {
        return request(input, "conv-test");
    }

    private static AgentRequest request(String input, String sessionId) {
        return AgentRequest.builder().input(input).sessionId(sessionId).userId("u1").build();
    }

    private Trace singleTrace() {
        assertThat(traces).hasSize(1);
        return traces.get(0);
    }

    private static Message last(List<Message> messages) {
        return messages.get(messages.size() - 1);
    }

    private static ModelCompletion completion(String text) {
        return ModelCompletion.builder().rawText(text).build();
    }

    private static ToolCall call(String id, String name, Map<String, Object> args) {
        return ToolCall.builder().id(id).toolName(name).arguments(args).build();
    }

    private static ModelCompletion sleepThenAnswer(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
        return completion("{{final_message: too late}}");
    }

    /** Replays queued replies, then falls back to a fixed behaviour if one is set. */
    private static class ScriptedLlm implements LlmClient {

        final List<List<Message>> snapshots = new CopyOnWriteArrayList<>();
        final List<List<ToolDefinition>> toolsOffered = new CopyOnWriteArrayList<>();
        private final List<Function<List<Message>, ModelCompletion>> queue = new ArrayList<>();
        private Function<List<Message>, ModelCompletion> fallback;

        void reply(String text) {
            queue.add(snapshot -> completion(text));
        }

        void reply(ModelCompletion completion) {
            queue.add(snapshot -> completion);
        }

        void reply(Function<List<Message>, ModelCompletion> step) {
            queue.add(step);
        }

        void always(Function<List<Message>, ModelCompletion> step) {
            fallback = step;
        }

        int calls() {
            return snapshots.size();
        }

        @Override
        public ModelCompletion complete(List<Message> messages, List<ToolDefinition> tools) {
            int index = snapshots.size();
            snapshots.add(messages);
            toolsOffered.add(tools);
            Function<List<Message>, ModelCompletion> step;
            synchronized (queue) {
                step = index < queue.size() ? queue.get(index) : fallback;
            }
            if (step == null) {
                throw new IllegalStateException("No scripted reply for call " + (index + 1));
            }
            return step.apply(messages);
        }
    }

    private static class RecipeSearchStub implements AgentTool {

        @Override
        public String getName() {
            return "search_recipes";
        }

        @Override
        public String getDescription() {
            return "Search recipes";
        }

        @Override
        public ToolCategory getCategory() {
            return ToolCategory.RECIPE_SEARCH;
        }

        @Override
        public Map<String, Object> getInputSchema() {
            return Map.of(
                    "type", "object",
                    "properties", Map.of("query", Map.of("type", "string")),
                    "required", List.of("query"));
        }

        @Override
        public String execute(Map<String, Object> arguments, ToolContext context) {
            return "3 recipes for " + arguments.get("query");
        }
    }

    private static class DelayedEchoTool implements AgentTool {

        @Override
        public String getName() {
            return "delayed_echo";
        }

        @Override
        public String getDescription() {
            return "Echoes text after an optional delay";
        }

        @Override
        public ToolCategory getCategory() {
            return ToolCategory.MEAL_PLANNING;
        }

        @Override
        public Map<String, Object> getInputSchema() {
            return Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "text", Map.of("type", "string"),
                            "delay_ms", Map.of("type", "integer")),
                    "required", List.of("text"));
        }

        @Override
        public String execute(Map<String, Object> arguments, ToolContext context) throws Exception {
            Object delay = arguments.get("delay_ms");
            if (delay instanceof Number n && n.longValue() > 0) {
                Thread.sleep(n.longValue());
            }
            return (String) arguments.get("text");
        }
    }
}
