package com.stationalmanac.core.model;

public class ValidationException extends IllegalArgumentException {
    public ValidationException(String message) {
        super(message);
    }

    static double requireRange(String field, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new ValidationException(field + " must be within [" + min + ", " + max + "] but was " + value);
        }
        return value;
    }

    static long requireRangeExclusive(String field, long value, long min, long maxExclusive) {
        if (value < min || value >= maxExclusive) {
            throw new ValidationException(field + " must be within [" + min + ", " + maxExclusive + ") but was " + value);
        }
        return value;
    }

    static String requireLength(String field, String value, int minLength, int maxLength) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        if (value.length() < minLength || value.length() > maxLength) {
            throw new ValidationException(
                    field + " length must be within [" + minLength + ", " + maxLength + "] but was " + value.length()
            );
        }
        return value;
    }
}
