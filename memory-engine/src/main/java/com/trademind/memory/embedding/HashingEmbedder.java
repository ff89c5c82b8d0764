package com.trademind.memory.embedding;

import com.trademind.common.exception.ValidationException;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.Embedding;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic feature-hashing embedder.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Normalise and split the text into word tokens; add adjacent-token bigrams.</li>
 *   <li>Hash every feature to a bucket in {@code [0, dimension)} with a sign bit.</li>
 *   <li>L2-normalise the accumulated vector.</li>
 * </ol>
 *
 * <p>Used as the primary encoder when no remote backend is configured and as the
 * degraded fallback when the backend fails. Pure and thread-safe.
 */
public class HashingEmbedder implements Embedder {

    private final int dimension;

    public HashingEmbedder(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public Mono<Embedding> embed(AgentEvent event) {
        return Mono.fromCallable(() -> encode(EventSummarizer.textFor(event)));
    }

    @Override
    public Mono<Embedding> embedText(String text) {
        return Mono.fromCallable(() -> encode(text));
    }

    @Override
    public EmbedderStatus status() {
        return new EmbedderStatus("hashing", true, 0, dimension);
    }

    /** Synchronous encoding; also used by {@link ResilientEmbedder} on fallback. */
    public Embedding encode(String text) {
        String normalized = EventSummarizer.normalize(text);
        if (normalized.isEmpty()) {
            throw new ValidationException("text to embed must not be empty");
        }
        float[] vector = new float[dimension];
        for (String feature : features(normalized)) {
            int h = mix(feature.hashCode());
            int bucket = Math.floorMod(h, dimension);
            vector[bucket] += ((h >>> 31) == 0) ? 1.0f : -1.0f;
        }
        double norm = 0.0;
        for (float v : vector) norm += v * v;
        if (norm == 0.0) {
            vector[Math.floorMod(mix(normalized.hashCode()), dimension)] = 1.0f;
            return new Embedding(vector);
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) vector[i] *= scale;
        return new Embedding(vector);
    }

    private static List<String> features(String normalized) {
        String[] tokens = normalized.split("[^a-z0-9.]+");
        List<String> features = new ArrayList<>();
        String previous = null;
        for (String token : tokens) {
            if (token.isEmpty()) continue;
            features.add(token);
            if (previous != null) features.add(previous + "_" + token);
            previous = token;
        }
        return features;
    }

    /** Murmur3 finaliser; spreads String.hashCode bits across the word. */
    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
