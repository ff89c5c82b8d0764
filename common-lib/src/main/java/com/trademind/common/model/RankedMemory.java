package com.trademind.common.model;

/** A retrieved record with its raw similarity and its re-ranked score. */
public record RankedMemory(MemoryRecord record, double similarity, double score) {
}
