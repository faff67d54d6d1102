package com.cheflink.agent.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Flag set from outside a run (e.g. the user went away). The loop reads it at
 * iteration boundaries only; in-flight tool calls finish normally.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
