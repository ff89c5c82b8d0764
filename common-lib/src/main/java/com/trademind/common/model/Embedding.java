package com.trademind.common.model;

import com.trademind.common.exception.ValidationException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-length float vector, copied on the way in and out; equality is by
 * content.
 */
public record Embedding(float[] values) {

    public Embedding {
        Objects.requireNonNull(values, "values");
        values = values.clone();
    }

    @Override
    public float[] values() {
        return values.clone();
    }

    public int dimension() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    /**
     * Cosine similarity in {@code [-1, 1]}; zero when either vector has zero norm.
     *
     * @throws ValidationException when the dimensions differ
     */
    public double cosineSimilarity(Embedding other) {
        if (other.values.length != values.length) {
            throw new ValidationException("dimension mismatch: " + values.length + " vs " + other.values.length);
        }
        double dot = 0.0, normA = 0.0, normB = 0.0;
        for (int i = 0; i < values.length; i++) {
            dot   += (double) values[i] * other.values[i];
            normA += (double) values[i] * values[i];
            normB += (double) other.values[i] * other.values[i];
        }
        if (normA == 0.0 || normB == 0.0) return 0.0;
        double sim = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, sim));
    }

    /** {@code 1 - cosineSimilarity}, in {@code [0, 2]}. */
    public double cosineDistance(Embedding other) {
        return 1.0 - cosineSimilarity(other);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Embedding other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Embedding[dimension=" + values.length + "]";
    }
}
