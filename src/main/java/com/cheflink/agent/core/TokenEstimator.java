package com.cheflink.agent.core;

/**
 * Counts tokens for message content. One estimator is used for every message
 * of a conversation so the running sum stays comparable with the budget.
 */
@FunctionalInterface
public interface TokenEstimator {

    int estimate(String text);
}
