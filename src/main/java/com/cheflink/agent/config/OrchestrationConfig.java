package com.cheflink.agent.config;

import com.cheflink.agent.core.CharacterTokenEstimator;
import com.cheflink.agent.core.ContextSummarizer;
import com.cheflink.agent.core.CostCalculator;
import com.cheflink.agent.core.ExtractiveContextSummarizer;
import com.cheflink.agent.core.LoopSettings;
import com.cheflink.agent.core.OrchestrationLoop;
import com.cheflink.agent.core.ResponseParser;
import com.cheflink.agent.core.TokenEstimator;
import com.cheflink.agent.llm.LlmClient;
import com.cheflink.agent.observability.TraceSink;
import com.cheflink.agent.tool.AgentTool;
import com.cheflink.agent.tool.ToolExecutor;
import com.cheflink.agent.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.List;

/**
 * Assembles the orchestration loop from its collaborators. The core classes
 * carry no Spring annotations; this is the only place they meet the container.
 */
@Configuration
@Slf4j
public class OrchestrationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Every AgentTool bean, in bean registration order */
    @Bean
    public ToolRegistry toolRegistry(List<AgentTool> tools) {
        return ToolRegistry.of(tools);
    }

    @Bean
    public ToolExecutor toolExecutor(ToolRegistry toolRegistry,
                                     @Qualifier("toolTaskExecutor") ThreadPoolTaskExecutor toolTaskExecutor,
                                     AgentProperties agentProperties) {
        return new ToolExecutor(toolRegistry, toolTaskExecutor, agentProperties.getTools().getMaxPayloadChars());
    }

    @Bean
    public ResponseParser responseParser(ObjectMapper objectMapper) {
        return new ResponseParser(objectMapper);
    }

    @Bean
    public TokenEstimator tokenEstimator() {
        return new CharacterTokenEstimator();
    }

    @Bean
    public ContextSummarizer contextSummarizer(AgentProperties agentProperties) {
        AgentProperties.Context context = agentProperties.getContext();
        return new ExtractiveContextSummarizer(context.getSummaryLineChars(), context.getSummaryMaxChars());
    }

    @Bean
    public CostCalculator costCalculator(AgentProperties agentProperties) {
        AgentProperties.Model.Pricing pricing = agentProperties.getModel().getPricing();
        return new CostCalculator(pricing.getInputPer1k(), pricing.getOutputPer1k());
    }

    @Bean
    public OrchestrationLoop orchestrationLoop(LlmClient llmClient,
                                               ToolRegistry toolRegistry,
                                               ToolExecutor toolExecutor,
                                               ResponseParser responseParser,
                                               TraceSink traceSink,
                                               CostCalculator costCalculator,
                                               ContextSummarizer contextSummarizer,
                                               TokenEstimator tokenEstimator,
                                               @Qualifier("modelCallExecutor") ThreadPoolTaskExecutor modelCallExecutor,
                                               Clock clock,
                                               AgentProperties agentProperties) {
        LoopSettings settings = agentProperties.toLoopSettings();
        log.info("Orchestration loop configured [mode={}, maxIterations={}, maxTime={}, costLimit=${}, contextMaxTokens={}]",
                agentProperties.getMode(), settings.getMaxIterations(), settings.getMaxTime(),
                settings.getCostLimit(), settings.getContextMaxTokens());
        return new OrchestrationLoop(llmClient, toolRegistry, toolExecutor, responseParser, traceSink,
                costCalculator, contextSummarizer, tokenEstimator,
                modelCallExecutor.getThreadPoolExecutor(), clock, settings);
    }
}
