package com.trademind.common.model;

import java.util.Locale;

/**
 * Retrieval request issued by an agent. {@code recencyBias}, when non-null, replaces the
 * configured recency weight for this call only.
 */
public record MemoryQuery(
    String text,
    QueryType type,
    String symbol,
    int k,
    Double recencyBias,
    boolean includeFailures
) {
    public MemoryQuery {
        type = type == null ? QueryType.GENERAL : type;
        text = text == null ? "" : text;
    }

    public static MemoryQuery of(String text, QueryType type, String symbol, int k) {
        return new MemoryQuery(text, type, symbol, k, null, false);
    }

    public MemoryQuery withRecencyBias(double bias) {
        return new MemoryQuery(text, type, symbol, k, bias, includeFailures);
    }

    public MemoryQuery includingFailures() {
        return new MemoryQuery(text, type, symbol, k, recencyBias, true);
    }

    /** Text actually embedded: the query, the symbol, then the type's expansion terms. */
    public String expandedText() {
        String base = symbol == null ? text : text + " " + symbol;
        return type.expand(base).trim();
    }

    /** Stable cache key component; equal queries produce equal signatures. */
    public String signature() {
        return String.join("|",
            type.name(),
            text.trim().toLowerCase(Locale.ROOT),
            symbol == null ? "" : symbol,
            Integer.toString(k),
            recencyBias == null ? "" : Double.toString(recencyBias),
            Boolean.toString(includeFailures));
    }
}
