package com.cheflink.agent.observability;

/**
 * Receives the finished trace of every run. Must not throw back into the loop.
 */
@FunctionalInterface
public interface TraceSink {

    void accept(Trace trace);
}
