package com.moviz.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One untyped row of a source dataset, keyed by source column name. Discarded after normalization.
 *
 * @param dataset   source dataset
 * @param rowNumber 1-based data row number across all stacked input files
 * @param values    source column name to raw cell value (values may be null)
 */
public record RawRecord(Dataset dataset, int rowNumber, Map<String, String> values) {
    public RawRecord {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String get(String column) {
        return values.get(column);
    }
}
