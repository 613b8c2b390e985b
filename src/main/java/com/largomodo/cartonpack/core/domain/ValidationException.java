package com.largomodo.cartonpack.core.domain;

/**
 * Thrown when a product or carton type is constructed with a value outside its allowed range.
 * <p>
 * Extends IllegalArgumentException so callers that already handle bad arguments keep working,
 * while hosts can still distinguish caller-recoverable input errors from defects.
 * The offending field is exposed via {@link #getField()}.
 */
public class ValidationException extends IllegalArgumentException {

    private final String field;

    /**
     * Constructs exception for a rejected field value.
     *
     * @param field   Name of the offending field (e.g. "length", "maxWeight")
     * @param message Details about the rejected value
     */
    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    static double requirePositive(String owner, String field, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new ValidationException(field,
                    owner + " " + field + " must be a positive number, got: " + value);
        }
        return value;
    }

    static int requirePositive(String owner, String field, int value) {
        if (value <= 0) {
            throw new ValidationException(field,
                    owner + " " + field + " must be positive, got: " + value);
        }
        return value;
    }
}
