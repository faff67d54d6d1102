package com.cheflink.agent.exception;

/**
 * Compression could not bring the conversation under its token budget.
 */
public class ContextOverflowException extends AgentException {

    private final int tokenCount;
    private final int maxTokens;

    public ContextOverflowException(int tokenCount, int maxTokens) {
        super("Conversation needs " + tokenCount + " tokens after compression, budget is " + maxTokens);
        this.tokenCount = tokenCount;
        this.maxTokens = maxTokens;
    }

    public int getTokenCount() {
        return tokenCount;
    }

    public int getMaxTokens() {
        return maxTokens;
    }
}
