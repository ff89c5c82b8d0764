package com.trademind.memory.embedding;

/**
 * @param backend       name of the primary backend ({@code remote} or {@code hashing})
 * @param available     whether the last call to the primary backend succeeded
 * @param fallbackCount encodings served by the hashing fallback since startup
 */
public record EmbedderStatus(String backend, boolean available, long fallbackCount, int dimension) {
}
