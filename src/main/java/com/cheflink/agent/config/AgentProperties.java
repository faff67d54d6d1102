package com.cheflink.agent.config;

import com.cheflink.agent.core.LoopSettings;
import com.cheflink.agent.tool.ToolCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Strongly-typed configuration of the orchestration loop.
 * Bound from application.yml under the "agent" prefix.
 */
@Data
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    public enum Mode { DIRECT, AGENTIC }

    private Mode mode = Mode.AGENTIC;

    private String systemPrompt = """
            You are ChefLink, a meal-planning assistant. Use the available tools to look up
            recipes, meal plans, nutrition and the user's dietary preferences before answering.
            When you are ready to answer the user, reply with {{final_message: <your answer>}}
            and nothing after it.
            """;

    private Budget budget = new Budget();
    private Model model = new Model();
    private Parser parser = new Parser();
    private Context context = new Context();
    private Tools tools = new Tools();

    @Data
    public static class Budget {
        private int maxIterations = 20;
        private Duration maxTime = Duration.ofSeconds(60);
        private double costLimit = 0.50;
        /** Caps max_tokens on every model request; unset keeps the provider setting */
        private Integer maxTokensPerCall;
    }

    @Data
    public static class Model {
        private Duration callTimeout = Duration.ofSeconds(30);
        /** Consecutive timeouts tolerated before the run fails */
        private int maxTimeouts = 2;
        private Pricing pricing = new Pricing();

        @Data
        public static class Pricing {
            private double inputPer1k = 0.015;
            private double outputPer1k = 0.075;
        }
    }

    @Data
    public static class Parser {
        private int maxInconclusive = 3;
    }

    @Data
    public static class Context {
        private int maxTokens = 8000;
        private double compressionThreshold = 0.85;
        private int retainRecent = 6;
        private int summaryLineChars = 120;
        private int summaryMaxChars = 1200;
    }

    @Data
    public static class Tools {
        private int maxPayloadChars = 4000;
        /** Empty means every category */
        private Set<ToolCategory> categories = new HashSet<>();
    }

    /**
     * Direct mode is the same loop allowed a single model call.
     */
    public LoopSettings toLoopSettings() {
        return LoopSettings.builder()
                .maxIterations(mode == Mode.DIRECT ? 1 : budget.getMaxIterations())
                .maxTime(budget.getMaxTime())
                .costLimit(budget.getCostLimit())
                .modelCallTimeout(model.getCallTimeout())
                .maxModelTimeouts(model.getMaxTimeouts())
                .maxInconclusive(parser.getMaxInconclusive())
                .contextMaxTokens(context.getMaxTokens())
                .compressionThreshold(context.getCompressionThreshold())
                .retainRecent(context.getRetainRecent())
                .allowedCategories(Set.copyOf(tools.getCategories()))
                .systemPrompt(systemPrompt)
                .build();
    }
}
