package com.trademind.memory.embedding;

import com.trademind.common.exception.ValidationException;
import com.trademind.common.model.AgentEvent;

import java.util.Locale;

/**
 * Builds the normalised text that gets embedded for an event: kind, category and symbol
 * prefixes followed by the event summary, lower-cased with whitespace collapsed.
 */
public final class EventSummarizer {

    private EventSummarizer() {}

    public static String textFor(AgentEvent event) {
        if (event == null || event.summary() == null || event.summary().isBlank()) {
            throw new ValidationException("event summary must not be empty");
        }
        StringBuilder sb = new StringBuilder();
        sb.append(event.kind().name()).append(' ');
        if (event.category() != null) sb.append(event.category().name()).append(' ');
        if (event.symbol() != null) sb.append(event.symbol()).append(' ');
        sb.append(event.summary());
        return normalize(sb.toString());
    }

    public static String normalize(String text) {
        if (text == null) return "";
        return text.replace('_', ' ')
                   .toLowerCase(Locale.ROOT)
                   .replaceAll("\\s+", " ")
                   .trim();
    }
}
