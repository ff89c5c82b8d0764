package com.trademind.memory.store;

import com.trademind.common.model.MemoryRecord;

/** A similarity hit joined with its metadata. {@code similarity} is cosine similarity. */
public record ScoredRecord(MemoryRecord record, double similarity) {

    public double distance() {
        return 1.0 - similarity;
    }
}
