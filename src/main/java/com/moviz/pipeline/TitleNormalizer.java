package com.moviz.pipeline;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The single title normalization shared by all datasets. Fallback-key matching is only valid because
 * every dataset goes through this exact function.
 */
public final class TitleNormalizer {
    private TitleNormalizer() {}

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Lowercases, strips every character that is not a letter, digit or whitespace, and collapses
     * whitespace runs to a single space. Idempotent.
     *
     * @param title original title (may be null)
     * @return normalized title, or null for null input
     */
    public static String normalize(String title) {
        if (title == null) return null;
        String lowered = title.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lowered).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }
}
