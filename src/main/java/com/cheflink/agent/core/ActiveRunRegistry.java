package com.cheflink.agent.core;

import com.cheflink.agent.exception.RunInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation handles of the runs currently in progress, by conversation id.
 */
@Component
@Slf4j
public class ActiveRunRegistry {

    private final Map<String, CancellationToken> running = new ConcurrentHashMap<>();

    /**
     * @throws RunInProgressException if this conversation already has a run in progress
     */
    public CancellationToken register(String conversationId) {
        CancellationToken token = new CancellationToken();
        CancellationToken previous = running.putIfAbsent(conversationId, token);
        if (previous != null) {
            throw new RunInProgressException("A run is already in progress for conversation " + conversationId);
        }
        return token;
    }

    public void unregister(String conversationId) {
        running.remove(conversationId);
    }

    /**
     * @return false if no run with this id is in progress
     */
    public boolean cancel(String conversationId) {
        CancellationToken token = running.get(conversationId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Cancellation requested [conversationId={}]", conversationId);
        return true;
    }

    public boolean isRunning(String conversationId) {
        return running.containsKey(conversationId);
    }
}
