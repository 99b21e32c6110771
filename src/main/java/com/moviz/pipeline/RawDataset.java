package com.moviz.pipeline;

import java.util.List;

/**
 * A fully loaded source dataset: its header (union of all stacked files, first-seen order) and rows.
 */
public record RawDataset(Dataset dataset, List<String> header, List<RawRecord> rows) {
    public RawDataset {
        header = List.copyOf(header);
        rows = List.copyOf(rows);
    }
}
