package com.cheflink.agent.core;

public enum LoopState {
    INIT,
    AWAITING_MODEL,
    PARSING,
    EXECUTING_TOOLS,
    TERMINATED
}
