package com.cheflink.agent.core;

import com.cheflink.agent.exception.AgentException;
import com.cheflink.agent.exception.ContextOverflowException;
import com.cheflink.agent.exception.ModelTimeoutException;
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
import com.cheflink.agent.observability.TraceRecorder;
import com.cheflink.agent.observability.TraceSink;
import com.cheflink.agent.tool.ToolContext;
import com.cheflink.agent.tool.ToolDefinition;
import com.cheflink.agent.tool.ToolExecutor;
import com.cheflink.agent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reason → act → observe controller for one user message.
 *
 * Per-run flow:
 * 1. Fresh conversation (system prompt + user input), budget and trace recorder
 * 2. Each iteration: budget check → compress → model call (with its own deadline)
 *    → parse → run tools and loop, or stop on a final message
 * 3. Exactly one AgentResponse; the trace goes to the sink whatever happened
 *
 * The loop is the only writer of the conversation. Tool executor threads
 * return values and the loop appends them in call order.
 */
@Slf4j
public class OrchestrationLoop {

    static final String BUDGET_FALLBACK =
            "Partial result, limits reached (%s) before I could finish. %s";
    static final String FAILURE_ANSWER =
            "Sorry, something went wrong while preparing your answer. Please try again.";
    static final String CORRECTIVE_NOTE =
            "Your last reply contained neither a tool call nor a final answer. "
            + "Either call one of the available tools, or reply with "
            + ResponseParser.FINAL_MESSAGE_MARKER + " <your answer>}}";

    private final LlmClient llmClient;
    private final ToolRegistry toolRegistry;
    private final ToolExecutor toolExecutor;
    private final ResponseParser responseParser;
    private final TraceSink traceSink;
    private final CostCalculator costCalculator;
    private final ContextSummarizer summarizer;
    private final TokenEstimator tokenEstimator;
    private final ExecutorService modelCallExecutor;
    private final Clock clock;
    private final LoopSettings settings;

    public OrchestrationLoop(LlmClient llmClient,
                             ToolRegistry toolRegistry,
                             ToolExecutor toolExecutor,
                             ResponseParser responseParser,
                             TraceSink traceSink,
                             CostCalculator costCalculator,
                             ContextSummarizer summarizer,
                             TokenEstimator tokenEstimator,
                             ExecutorService modelCallExecutor,
                             Clock clock,
                             LoopSettings settings) {
        this.llmClient = llmClient;
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.responseParser = responseParser;
        this.traceSink = traceSink;
        this.costCalculator = costCalculator;
        this.summarizer = summarizer;
        this.tokenEstimator = tokenEstimator;
        this.modelCallExecutor = modelCallExecutor;
        this.clock = clock;
        this.settings = settings;
    }

    public AgentResponse run(AgentRequest request) {
        return run(request, CancellationToken.none());
    }

    public AgentResponse run(AgentRequest request, CancellationToken cancellation) {
        String conversationId = resolveConversationId(request.getSessionId());
        String userId = request.getUserId() != null && !request.getUserId().isBlank()
                ? request.getUserId() : "default";

        log.info("Agent run started [conversationId={}, userId={}, input='{}']",
                conversationId, userId, request.getInput());

        Run run = new Run(conversationId, userId, request.getInput());
        Termination termination;

        try {
            termination = executeLoop(run, cancellation);
        } catch (ContextOverflowException e) {
            log.error("Context overflow [conversationId={}]: {}", conversationId, e.getMessage());
            termination = Termination.failure(TerminationReason.FATAL_ERROR, e.getMessage());
        } catch (Exception e) {
            log.error("Agent run failed [conversationId={}]", conversationId, e);
            termination = Termination.failure(TerminationReason.FATAL_ERROR, e.getMessage());
        }

        run.transition(LoopState.TERMINATED);
        Trace trace = run.recorder.finish(termination.reason(), termination.answer(), termination.error());
        publish(trace);

        log.info("Agent run complete [conversationId={}, reason={}, iterations={}, cost=${}, duration={}ms]",
                conversationId, termination.reason().wireName(), run.budget.iterationCount(),
                String.format("%.4f", run.budget.cumulativeCost()), trace.getTotalDurationMs());

        return AgentResponse.builder()
                .finalAnswer(termination.answer())
                .toolCallsExecuted(run.executedCalls)
                .iterationsUsed(run.budget.iterationCount())
                .terminationReason(termination.reason())
                .conversationId(conversationId)
                .build();
    }

    private Termination executeLoop(Run run, CancellationToken cancellation) {
        ConversationContext context = run.context;
        context.append(message(Message.Role.system, settings.getSystemPrompt()));
        context.append(message(Message.Role.user, run.userInput));

        int consecutiveTimeouts = 0;
        int consecutiveInconclusive = 0;

        while (true) {
            if (cancellation.isCancelled()) {
                log.info("Run cancelled at iteration boundary [conversationId={}]", run.conversationId);
                return Termination.failure(TerminationReason.FATAL_ERROR, "cancelled");
            }

            Optional<TerminationReason> exhausted = run.budget.check();
            if (exhausted.isPresent()) {
                log.warn("Agent hit {} after {} iterations [conversationId={}]",
                        exhausted.get().wireName(), run.budget.iterationCount(), run.conversationId);
                return Termination.answer(exhausted.get(), fallbackAnswer(exhausted.get(), run));
            }

            context.compressIfNeeded();

            int index = run.budget.iterationCount();
            log.info("Agent iteration {}/{} [conversationId={}]",
                    index + 1, settings.getMaxIterations(), run.conversationId);

            run.transition(LoopState.AWAITING_MODEL);
            List<Message> snapshot = context.snapshotForModel();
            List<ToolDefinition> tools = toolRegistry.exportSchema(settings.getAllowedCategories());

            Instant callStart = clock.instant();
            ModelCompletion completion;
            try {
                completion = callModel(snapshot, tools);
            } catch (ModelTimeoutException e) {
                Duration took = since(callStart);
                run.budget.recordIteration(0, took);
                run.recorder.recordIteration(IterationRecord.builder()
                        .index(index)
                        .outcome(IterationRecord.Outcome.MODEL_TIMEOUT)
                        .durationMs(took.toMillis())
                        .build());
                consecutiveTimeouts++;
                log.warn("Model call timed out ({}/{}) [conversationId={}]",
                        consecutiveTimeouts, settings.getMaxModelTimeouts(), run.conversationId);
                if (consecutiveTimeouts > settings.getMaxModelTimeouts()) {
                    return Termination.failure(TerminationReason.FATAL_ERROR,
                            "Model timed out " + consecutiveTimeouts + " consecutive times");
                }
                continue;
            } catch (AgentException e) {
                Duration took = since(callStart);
                run.budget.recordIteration(0, took);
                run.recorder.recordIteration(IterationRecord.builder()
                        .index(index)
                        .outcome(IterationRecord.Outcome.MODEL_ERROR)
                        .internalReasoning(e.getMessage())
                        .durationMs(took.toMillis())
                        .build());
                log.error("Model call failed [conversationId={}]: {}", run.conversationId, e.getMessage());
                return Termination.failure(TerminationReason.FATAL_ERROR, e.getMessage());
            }
            consecutiveTimeouts = 0;

            Duration took = since(callStart);
            double cost = costCalculator.cost(completion);
            run.budget.recordIteration(cost, took);

            run.transition(LoopState.PARSING);
            ParsedResponse parsed = responseParser.parse(completion);

            IterationRecord.IterationRecordBuilder record = IterationRecord.builder()
                    .index(index)
                    .rawModelOutput(completion.getRawText())
                    .internalReasoning(parsed.internalReasoning())
                    .cost(cost)
                    .durationMs(took.toMillis())
                    .promptTokens(completion.getPromptTokens())
                    .completionTokens(completion.getCompletionTokens());

            switch (parsed.kind()) {
                case FINAL_MESSAGE -> {
                    context.append(message(Message.Role.assistant, parsed.finalMessage()));
                    run.recorder.recordIteration(record.outcome(IterationRecord.Outcome.FINAL_MESSAGE).build());
                    return Termination.answer(TerminationReason.FINAL_MESSAGE, parsed.finalMessage());
                }
                case TOOL_CALLS -> {
                    consecutiveInconclusive = 0;
                    run.transition(LoopState.EXECUTING_TOOLS);
                    List<ToolResult> results = executeTools(run, parsed);
                    run.recorder.recordIteration(record
                            .outcome(IterationRecord.Outcome.TOOL_CALLS)
                            .toolCalls(parsed.toolCalls())
                            .toolResults(results)
                            .build());
                }
                case INCONCLUSIVE -> {
                    String rawText = completion.getRawText();
                    if (settings.isSinglePass() && rawText != null && !rawText.isBlank()) {
                        // a single pass has no second call to correct, so plain text is the answer
                        String answer = rawText.strip();
                        context.append(message(Message.Role.assistant, answer));
                        run.recorder.recordIteration(record.outcome(IterationRecord.Outcome.FINAL_MESSAGE).build());
                        return Termination.answer(TerminationReason.FINAL_MESSAGE, answer);
                    }
                    consecutiveInconclusive++;
                    run.recorder.recordIteration(record.outcome(IterationRecord.Outcome.INCONCLUSIVE).build());
                    log.warn("Inconclusive model output ({}/{}) [conversationId={}]",
                            consecutiveInconclusive, settings.getMaxInconclusive(), run.conversationId);
                    if (consecutiveInconclusive >= settings.getMaxInconclusive()) {
                        return Termination.failure(TerminationReason.FATAL_ERROR,
                                "No tool call or final message after " + consecutiveInconclusive + " attempts");
                    }
                    if (rawText != null && !rawText.isBlank()) {
                        context.append(message(Message.Role.assistant, rawText));
                    }
                    context.append(message(Message.Role.system, CORRECTIVE_NOTE));
                }
            }
        }
    }

    /**
     * Echoes the calls back as an assistant message, runs them, then appends one
     * tool message per result in the order the model issued the calls.
     */
    private List<ToolResult> executeTools(Run run, ParsedResponse parsed) {
        List<ToolCall> calls = parsed.toolCalls();
        log.info("Model requested {} tool call(s): {} [conversationId={}]",
                calls.size(), calls.stream().map(ToolCall::getToolName).toList(), run.conversationId);

        String reasoning = parsed.internalReasoning() != null && !parsed.internalReasoning().isBlank()
                ? parsed.internalReasoning() : null;
        int callTokens = calls.stream()
                .mapToInt(c -> tokenEstimator.estimate(c.getToolName() + String.valueOf(c.getArguments())))
                .sum();
        run.context.append(Message.builder()
                .role(Message.Role.assistant)
                .content(reasoning)
                .toolCalls(calls)
                .tokenCount(tokenEstimator.estimate(reasoning) + callTokens)
                .timestamp(clock.instant())
                .build());

        List<ToolResult> results = toolExecutor.executeAll(calls, run.toolContext);

        for (ToolResult result : results) {
            String observation = result.toObservation();
            run.context.append(Message.builder()
                    .role(Message.Role.tool)
                    .toolCallId(result.getCallId())
                    .name(result.getToolName())
                    .content(observation)
                    .tokenCount(tokenEstimator.estimate(observation))
                    .timestamp(clock.instant())
                    .build());
        }
        run.executedCalls.addAll(calls);
        run.successfulResults += (int) results.stream().filter(ToolResult::isSuccess).count();
        return results;
    }

    private ModelCompletion callModel(List<Message> snapshot, List<ToolDefinition> tools) {
        Future<ModelCompletion> future;
        try {
            future = modelCallExecutor.submit(() -> llmClient.complete(snapshot, tools));
        } catch (RejectedExecutionException e) {
            throw new AgentException("Model call rejected: executor saturated", e);
        }

        Duration timeout = settings.getModelCallTimeout();
        try {
            ModelCompletion completion = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (completion == null) {
                throw new AgentException("Model returned no completion");
            }
            return completion;
        } catch (TimeoutException e) {
            // Nothing from a cancelled call ever reaches the conversation
            future.cancel(true);
            throw new ModelTimeoutException(timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AgentException("Interrupted while waiting for the model", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AgentException agentException) {
                throw agentException;
            }
            throw new AgentException("Model call failed: " + cause.getMessage(), cause);
        }
    }

    private void publish(Trace trace) {
        try {
            traceSink.accept(trace);
        } catch (Exception e) {
            log.error("Trace sink rejected trace [conversationId={}]", trace.getConversationId(), e);
        }
    }

    private String fallbackAnswer(TerminationReason reason, Run run) {
        String detail = run.successfulResults > 0
                ? "I gathered results from " + run.successfulResults
                  + " tool call(s) but did not get to a complete answer. Please narrow the request and try again."
                : "Please narrow the request and try again.";
        return String.format(BUDGET_FALLBACK, reason.wireName().replace('_', ' '), detail);
    }

    private Message message(Message.Role role, String content) {
        return Message.builder()
                .role(role)
                .content(content)
                .tokenCount(tokenEstimator.estimate(content))
                .timestamp(clock.instant())
                .build();
    }

    private Duration since(Instant start) {
        return Duration.between(start, clock.instant());
    }

    private String resolveConversationId(String provided) {
        return (provided != null && !provided.isBlank()) ? provided : UUID.randomUUID().toString();
    }

    public LoopSettings settings() {
        return settings;
    }

    /** Mutable state of a single run; never shared between runs. */
    private final class Run {

        final String conversationId;
        final String userInput;
        final ConversationContext context;
        final BudgetTracker budget;
        final TraceRecorder recorder;
        final ToolContext toolContext;
        final List<ToolCall> executedCalls = new ArrayList<>();
        int successfulResults;
        LoopState state = LoopState.INIT;

        Run(String conversationId, String userId, String userInput) {
            this.conversationId = conversationId;
            this.userInput = userInput;
            this.context = new ConversationContext(settings.getContextMaxTokens(),
                    settings.getCompressionThreshold(), settings.getRetainRecent(), summarizer, tokenEstimator);
            this.budget = new BudgetTracker(settings.getMaxIterations(), settings.getMaxTime(),
                    settings.getCostLimit(), clock);
            this.recorder = new TraceRecorder(conversationId, userId, userInput, clock);
            this.toolContext = new ToolContext(conversationId, userId, settings.getAllowedCategories());
        }

        void transition(LoopState next) {
            if (state == next) {
                return;
            }
            log.debug("State {} -> {} [conversationId={}]", state, next, conversationId);
            recorder.recordTransition(state, next);
            state = next;
        }
    }

    private record Termination(TerminationReason reason, String answer, String error) {

        static Termination answer(TerminationReason reason, String answer) {
            return new Termination(reason, answer, null);
        }

        static Termination failure(TerminationReason reason, String error) {
            return new Termination(reason, FAILURE_ANSWER, error);
        }
    }
}
