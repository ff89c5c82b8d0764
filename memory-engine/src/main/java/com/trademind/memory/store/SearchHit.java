package com.trademind.memory.store;

/** Raw index hit ordered by ascending cosine {@code distance}. */
public record SearchHit(String recordId, double distance) {
}
