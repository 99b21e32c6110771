package com.moviz.pipeline;

import java.util.Locale;

/**
 * MPAA-equivalent content certificate. Foreign and legacy ratings are remapped onto these values;
 * anything unmapped becomes {@link #UNKNOWN}.
 */
public enum Certificate {
    G("G"),
    PG("PG"),
    PG_13("PG-13"),
    R("R"),
    NC_17("NC-17"),
    APPROVED("Approved"),
    PASSED("Passed"),
    UNRATED("Unrated"),
    NOT_RATED("NR"),
    UNKNOWN("Unknown");

    private final String label;

    Certificate(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Looks a certificate up by its label, case-insensitively.
     * @param label label such as "PG-13" or "NR"
     * @return matching certificate, or {@link #UNKNOWN}
     */
    public static Certificate fromLabel(String label) {
        if (label == null) return UNKNOWN;
        String wanted = label.trim().toLowerCase(Locale.ROOT);
        for (Certificate c : values()) {
            if (c.label.toLowerCase(Locale.ROOT).equals(wanted)) return c;
        }
        return UNKNOWN;
    }
}
