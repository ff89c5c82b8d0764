package com.trademind.common.exception;

/** Malformed input: out-of-range scores, wrong embedding dimension, blank summaries. */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new ValidationException(message);
        }
    }

    public static double requireUnitInterval(double value, String field) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(field + " must be within [0, 1] but was " + value);
        }
        return value;
    }
}
