package com.amannmalik.money.util;

import java.util.Objects;

/**
 * Small collection of reusable invariant guards. Keeps constructor code terse while
 * still making violations fail-fast and obvious.
 */
public final class Ensure {
    private Ensure() {
    }

    public static String nonBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " MUST be non-blank");
        }
        return value;
    }

    public static <T> T notNull(String field, T value) {
        return Objects.requireNonNull(value, field + " MUST NOT be null");
    }

    public static int nonNegative(String field, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " MUST be >= 0");
        }
        return value;
    }
}
