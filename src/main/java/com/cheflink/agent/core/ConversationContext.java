package com.cheflink.agent.core;

import com.cheflink.agent.exception.ContextOverflowException;
import com.cheflink.agent.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered message history of one run, with token accounting.
 *
 * Owned by the orchestration loop: it is the only caller of the mutating
 * methods, so the class is not thread-safe.
 *
 * Invariant: {@link #runningTokenCount()} always equals the sum of the token
 * counts of {@link #snapshotForModel()}.
 */
@Slf4j
public class ConversationContext {

    private final List<Message> messages = new ArrayList<>();
    private final int maxTokens;
    private final double compressionThreshold;
    private final int retainRecent;
    private final ContextSummarizer summarizer;
    private final TokenEstimator tokenEstimator;

    private int runningTokens;
    private int compressionCount;

    public ConversationContext(int maxTokens,
                               double compressionThreshold,
                               int retainRecent,
                               ContextSummarizer summarizer,
                               TokenEstimator tokenEstimator) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        if (compressionThreshold <= 0 || compressionThreshold > 1) {
            throw new IllegalArgumentException("compressionThreshold must be in (0, 1]");
        }
        if (retainRecent < 1) {
            throw new IllegalArgumentException("retainRecent must be at least 1");
        }
        this.maxTokens = maxTokens;
        this.compressionThreshold = compressionThreshold;
        this.retainRecent = retainRecent;
        this.summarizer = summarizer;
        this.tokenEstimator = tokenEstimator;
    }

    /**
     * @throws IllegalArgumentException if the message has no token count
     */
    public void append(Message message) {
        if (message.getTokenCount() == null) {
            throw new IllegalArgumentException("Message token count must be computed before append");
        }
        if (message.getTokenCount() < 0) {
            throw new IllegalArgumentException("Message token count cannot be negative");
        }
        messages.add(message);
        runningTokens += message.getTokenCount();
    }

    public List<Message> snapshotForModel() {
        return List.copyOf(messages);
    }

    /**
     * Replaces the older part of the history with one summary when the running
     * sum is above {@code maxTokens * compressionThreshold}.
     *
     * Never touches the leading system message or the most recent
     * {@code retainRecent} messages, widened so that a tool call and its
     * results stay together.
     *
     * @return true if the history was rewritten
     * @throws ContextOverflowException if the history still exceeds maxTokens
     */
    public boolean compressIfNeeded() {
        if (runningTokens <= maxTokens * compressionThreshold) {
            return false;
        }

        int head = hasSystemHead() ? 1 : 0;
        int suffixStart = suffixStart(head);
        List<Message> prefix = messages.subList(head, suffixStart);

        if (prefix.isEmpty() || (prefix.size() == 1
                && prefix.get(0).getRole() == Message.Role.assistant_internal)) {
            if (runningTokens > maxTokens) {
                throw new ContextOverflowException(runningTokens, maxTokens);
            }
            return false;
        }

        int before = runningTokens;
        int droppedCount = prefix.size();
        int prefixTokens = prefix.stream().mapToInt(Message::getTokenCount).sum();
        String summaryText = summarizer.summarize(List.copyOf(prefix));
        Message summary = Message.builder()
                .role(Message.Role.assistant_internal)
                .content(summaryText)
                .tokenCount(tokenEstimator.estimate(summaryText))
                .timestamp(messages.get(suffixStart - 1).getTimestamp())
                .build();

        // a summary that is not smaller than what it replaces is discarded
        if (summary.getTokenCount() >= prefixTokens) {
            log.debug("Skipping compression: summary of {} tokens does not shrink prefix of {} tokens",
                    summary.getTokenCount(), prefixTokens);
            if (runningTokens > maxTokens) {
                throw new ContextOverflowException(runningTokens, maxTokens);
            }
            return false;
        }

        List<Message> rewritten = new ArrayList<>(messages.size() - droppedCount + 1);
        rewritten.addAll(messages.subList(0, head));
        rewritten.add(summary);
        rewritten.addAll(messages.subList(suffixStart, messages.size()));

        messages.clear();
        messages.addAll(rewritten);
        runningTokens = messages.stream().mapToInt(Message::getTokenCount).sum();
        compressionCount++;

        log.info("Compressed context #{}: {} messages -> 1 summary, tokens {} -> {} (max={})",
                compressionCount, droppedCount, before, runningTokens, maxTokens);

        if (runningTokens > maxTokens) {
            throw new ContextOverflowException(runningTokens, maxTokens);
        }
        return true;
    }

    /**
     * First index of the verbatim suffix. Starts {@code retainRecent} from the end
     * and moves back while it would split a tool-call/result group.
     */
    private int suffixStart(int head) {
        int start = Math.max(head, messages.size() - retainRecent);
        while (start > head && messages.get(start).getRole() == Message.Role.tool) {
            start--;
        }
        return start;
    }

    private boolean hasSystemHead() {
        return !messages.isEmpty() && messages.get(0).getRole() == Message.Role.system;
    }

    public int runningTokenCount() {
        return runningTokens;
    }

    public int maxTokens() {
        return maxTokens;
    }

    public int compressionCount() {
        return compressionCount;
    }

    public int size() {
        return messages.size();
    }

    public TokenEstimator tokenEstimator() {
        return tokenEstimator;
    }
}
