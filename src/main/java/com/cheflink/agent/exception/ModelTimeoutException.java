package com.cheflink.agent.exception;

import java.time.Duration;

public class ModelTimeoutException extends AgentException {

    public ModelTimeoutException(Duration timeout) {
        super("Model call exceeded its deadline of " + timeout.toMillis() + "ms");
    }
}
