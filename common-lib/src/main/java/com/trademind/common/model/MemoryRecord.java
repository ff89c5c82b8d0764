package com.trademind.common.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Persisted learning unit: the embedding of an event plus the metadata needed to rank
 * and filter it. Only {@code outcomeLabel} changes after insert.
 *
 * <p>{@code createdAt} is held at millisecond precision, matching what the metadata table
 * stores. {@code symbol} and {@code outcomeLabel} may be {@code null}.
 */
public record MemoryRecord(
    String recordId,
    Embedding embedding,
    String summary,
    String agentId,
    EventKind eventKind,
    double importance,
    Instant createdAt,
    OutcomeLabel outcomeLabel,
    String symbol
) {
    public MemoryRecord {
        Objects.requireNonNull(embedding, "embedding");
        Objects.requireNonNull(eventKind, "eventKind");
        Objects.requireNonNull(createdAt, "createdAt");
        createdAt = createdAt.truncatedTo(ChronoUnit.MILLIS);
    }

    public MemoryRecord withRecordId(String id) {
        return new MemoryRecord(id, embedding, summary, agentId, eventKind, importance,
                                createdAt, outcomeLabel, symbol);
    }

    public MemoryRecord withOutcomeLabel(OutcomeLabel label) {
        return new MemoryRecord(recordId, embedding, summary, agentId, eventKind, importance,
                                createdAt, label, symbol);
    }

    public boolean isFailure() {
        return outcomeLabel == OutcomeLabel.FAILURE;
    }
}
