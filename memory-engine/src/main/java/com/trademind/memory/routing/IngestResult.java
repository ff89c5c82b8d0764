package com.trademind.memory.routing;

/**
 * Result of routing one event.
 *
 * @param stored           whether a MemoryRecord was created
 * @param recordId         id of the created record, {@code null} when not stored
 * @param importance       computed admission score
 * @param delivered        subscribers notified successfully
 * @param failed           subscribers whose delivery failed after retries
 * @param persistenceError message of the embed/persist failure, {@code null} on success
 */
public record IngestResult(boolean stored, String recordId, double importance,
                           int delivered, int failed, String persistenceError) {

    public boolean persistenceFailed() {
        return persistenceError != null;
    }
}
