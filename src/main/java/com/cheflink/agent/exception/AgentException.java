package com.cheflink.agent.exception;

/**
 * Base unchecked exception for failures the agent cannot recover from by itself.
 * Tool faults never surface as this type; they are normalized into tool results.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
