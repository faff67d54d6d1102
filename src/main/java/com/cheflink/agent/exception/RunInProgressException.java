package com.cheflink.agent.exception;

/**
 * A second run was started for a conversation whose first run has not ended,
 * or a request reused an Idempotency-Key that is still being processed.
 */
public class RunInProgressException extends AgentException {

    public RunInProgressException(String message) {
        super(message);
    }
}
