package com.moviz.pipeline;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Canonicalizes free-text genre labels against a lookup table.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Splits a raw cell ("Action, Drama" or a stringified list "['Action', 'Drama']") into labels.</li>
 *   <li>Title-cases each label ("sci-fi" becomes "Sci-Fi") and looks it up case-insensitively.</li>
 *   <li>Unmapped labels survive as their own title-cased entry; the vocabulary is open.</li>
 * </ul>
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public class GenreMapper {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LIST_BRACKETS = Pattern.compile("^\\[|]$");

    private final Map<String, String> table = new HashMap<>();

    /**
     * @param table source label to canonical label; keys are matched case-insensitively
     */
    public GenreMapper(Map<String, String> table) {
        for (Map.Entry<String, String> entry : table.entrySet()) {
            this.table.put(key(entry.getKey()), entry.getValue());
        }
    }

    /**
     * Splits and canonicalizes a raw genre cell. Duplicates are removed, first occurrence order kept.
     * @param raw raw cell value (may be null)
     * @return canonical labels, empty when the cell is blank
     */
    public List<String> mapLabels(String raw) {
        String cleaned = Utils.blankToNull(raw);
        if (cleaned == null) return List.of();
        cleaned = LIST_BRACKETS.matcher(cleaned).replaceAll("");
        LinkedHashSet<String> labels = new LinkedHashSet<>();
        for (String part : cleaned.split(",")) {
            String label = part.strip();
            label = label.replaceAll("^['\"]+|['\"]+$", "").strip();
            if (label.isEmpty()) continue;
            labels.add(canonicalize(label));
        }
        return new ArrayList<>(labels);
    }

    public String canonicalize(String label) {
        String collapsed = WHITESPACE.matcher(label.strip()).replaceAll(" ");
        String mapped = table.get(key(collapsed));
        return mapped != null ? mapped : titleCase(collapsed);
    }

    /**
     * Comparison key for genre names: lowercase, single-spaced.
     */
    public static String key(String name) {
        return WHITESPACE.matcher(name.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    // Upper-cases every letter that follows a non-letter, lower-cases the rest
    static String titleCase(String label) {
        StringBuilder sb = new StringBuilder(label.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                sb.append(c);
                previousIsLetter = false;
            }
        }
        return sb.toString();
    }
}
