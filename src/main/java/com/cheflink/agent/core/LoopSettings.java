package com.cheflink.agent.core;

import com.cheflink.agent.tool.ToolCategory;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Everything that shapes how one OrchestrationLoop behaves, fixed at
 * construction. A direct (non-agentic) single pass is just
 * {@code maxIterations = 1}.
 */
@Value
@Builder(toBuilder = true)
public class LoopSettings {

    @Builder.Default int maxIterations = 20;
    @Builder.Default Duration maxTime = Duration.ofSeconds(60);
    @Builder.Default double costLimit = 0.50;

    @Builder.Default Duration modelCallTimeout = Duration.ofSeconds(30);
    /** Consecutive model timeouts tolerated before the run is aborted */
    @Builder.Default int maxModelTimeouts = 2;
    /** Consecutive outputs with neither tool call nor final message before giving up */
    @Builder.Default int maxInconclusive = 3;

    @Builder.Default int contextMaxTokens = 8000;
    @Builder.Default double compressionThreshold = 0.85;
    @Builder.Default int retainRecent = 6;

    /** Empty means every registered category */
    @Builder.Default Set<ToolCategory> allowedCategories = Set.of();

    @Builder.Default String systemPrompt = "You are a helpful meal-planning assistant.";

    /** One model call and no corrective retry; a plain-text reply is taken as the answer. */
    public boolean isSinglePass() {
        return maxIterations == 1;
    }
}
