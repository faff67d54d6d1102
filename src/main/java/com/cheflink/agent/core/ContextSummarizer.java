package com.cheflink.agent.core;

import com.cheflink.agent.model.Message;

import java.util.List;

/**
 * Condenses the older part of a conversation into a single piece of text.
 * Lossy by nature: the result only has to keep the model oriented.
 */
@FunctionalInterface
public interface ContextSummarizer {

    String summarize(List<Message> dropped);
}
