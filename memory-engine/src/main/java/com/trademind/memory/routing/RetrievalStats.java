package com.trademind.memory.routing;

public record RetrievalStats(long queries, long cacheHits, long failures, int cachedEntries, String currentTick) {
}
