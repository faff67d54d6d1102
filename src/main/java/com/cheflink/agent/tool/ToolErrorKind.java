package com.cheflink.agent.tool;

public enum ToolErrorKind {

    UNKNOWN_TOOL("UnknownTool"),
    VALIDATION_ERROR("ValidationError"),
    EXECUTION_ERROR("ExecutionError");

    private final String wireName;

    ToolErrorKind(String wireName) {
        this.wireName = wireName;
    }

    /** Name shown to the model in failed tool observations */
    public String wireName() {
        return wireName;
    }
}
