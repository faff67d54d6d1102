package com.cheflink.agent.core;

import com.cheflink.agent.model.Message;

import java.util.List;

/**
 * Summarizes without a model call: one clipped line per dropped message,
 * capped overall. Previous summaries are carried over first so nothing
 * already condensed is lost twice.
 */
public class ExtractiveContextSummarizer implements ContextSummarizer {

    static final String HEADER = "[Previous conversation history compressed. Key context maintained.]";

    private final int maxLineChars;
    private final int maxSummaryChars;

    public ExtractiveContextSummarizer(int maxLineChars, int maxSummaryChars) {
        this.maxLineChars = maxLineChars;
        this.maxSummaryChars = maxSummaryChars;
    }

    public ExtractiveContextSummarizer() {
        this(120, 1200);
    }

    @Override
    public String summarize(List<Message> dropped) {
        StringBuilder sb = new StringBuilder(HEADER);

        for (Message m : dropped) {
            String line = describe(m);
            if (line.isEmpty()) {
                continue;
            }
            if (sb.length() + line.length() + 1 > maxSummaryChars) {
                sb.append("\n- ...");
                break;
            }
            sb.append('\n').append(line);
        }
        return sb.toString();
    }

    private String describe(Message m) {
        if (m.getRole() == Message.Role.assistant_internal) {
            // Fold an earlier summary in without repeating its header
            return stripHeader(m.getContent());
        }
        if (m.hasToolCalls()) {
            return "- assistant called: " + m.getToolCalls().stream()
                    .map(tc -> tc.getToolName())
                    .toList();
        }
        String content = m.getContent();
        if (content == null || content.isBlank()) {
            return "";
        }
        String label = m.getRole() == Message.Role.tool ? "tool " + m.getName() : m.getRole().name();
        return "- " + label + ": " + clip(content.strip().replace('\n', ' '));
    }

    private String stripHeader(String content) {
        if (content == null) {
            return "";
        }
        return content.startsWith(HEADER) ? content.substring(HEADER.length()).strip() : content.strip();
    }

    private String clip(String s) {
        return s.length() <= maxLineChars ? s : s.substring(0, maxLineChars) + "...";
    }
}
