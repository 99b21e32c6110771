package com.moviz.pipeline;

/**
 * The {@code (normalizedTitle, year)} pair used to match records that share no native identifier.
 */
public record FallbackKey(String normalizedTitle, int year) {
    public FallbackKey {
        if (normalizedTitle == null) {
            throw new IllegalArgumentException("normalizedTitle cannot be null");
        }
    }

    @Override
    public String toString() {
        return normalizedTitle + "_" + year;
    }
}
