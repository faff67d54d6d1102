package com.cheflink.agent.exception;

/**
 * The model provider could not be reached after retries, or its circuit is open.
 */
public class ModelUnavailableException extends AgentException {

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
