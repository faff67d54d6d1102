package com.cheflink.agent.exception;

public class UnknownToolException extends AgentException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool '" + toolName + "'");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
