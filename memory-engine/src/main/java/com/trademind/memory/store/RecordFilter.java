package com.trademind.memory.store;

import com.trademind.common.model.EventKind;
import com.trademind.common.model.OutcomeLabel;

import java.util.Set;

/**
 * Metadata predicate applied to similarity hits. {@code null} / empty fields match
 * everything.
 */
public record RecordFilter(Set<EventKind> kinds, String symbol, String agentId, boolean excludeFailures) {

    public static final RecordFilter NONE = new RecordFilter(Set.of(), null, null, false);

    public RecordFilter {
        kinds = kinds == null ? Set.of() : Set.copyOf(kinds);
    }

    public static RecordFilter excludingFailures() {
        return new RecordFilter(Set.of(), null, null, true);
    }

    public RecordFilter withKinds(Set<EventKind> eventKinds) {
        return new RecordFilter(eventKinds, symbol, agentId, excludeFailures);
    }

    public RecordFilter withSymbol(String sym) {
        return new RecordFilter(kinds, sym, agentId, excludeFailures);
    }

    boolean matches(MemoryMetadataRow row) {
        if (!kinds.isEmpty() && kinds.stream().noneMatch(k -> k.name().equals(row.getEventKind()))) {
            return false;
        }
        if (symbol != null && !symbol.equals(row.getSymbol())) return false;
        if (agentId != null && !agentId.equals(row.getAgentId())) return false;
        return !(excludeFailures && OutcomeLabel.FAILURE.name().equals(row.getOutcomeLabel()));
    }
}
