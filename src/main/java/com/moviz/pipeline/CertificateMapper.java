package com.moviz.pipeline;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Table-driven remap of foreign and legacy rating systems onto {@link Certificate}.
 * Unmapped labels pass through as {@link Certificate#UNKNOWN}; they never reject a record.
 */
public class CertificateMapper {
    private final Map<String, Certificate> exact = new HashMap<>();
    private final Map<String, Certificate> caseInsensitive = new HashMap<>();

    /**
     * @param table source label to target certificate label, e.g. "TV-14" to "PG-13"
     */
    public CertificateMapper(Map<String, String> table) {
        for (Map.Entry<String, String> entry : table.entrySet()) {
            Certificate target = Certificate.fromLabel(entry.getValue());
            exact.put(entry.getKey().trim(), target);
            caseInsensitive.putIfAbsent(entry.getKey().trim().toLowerCase(Locale.ROOT), target);
        }
    }

    public Certificate map(String label) {
        String cleaned = Utils.blankToNull(label);
        if (cleaned == null) return Certificate.UNKNOWN;
        Certificate hit = exact.get(cleaned);
        if (hit == null) hit = caseInsensitive.get(cleaned.toLowerCase(Locale.ROOT));
        return hit == null ? Certificate.UNKNOWN : hit;
    }
}
