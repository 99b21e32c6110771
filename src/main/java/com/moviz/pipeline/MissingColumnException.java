package com.moviz.pipeline;

import java.util.List;

/**
 * A dataset lacks a column that normalization cannot do without (a title or any date-like column).
 * Downstream joins are meaningless without it, so the whole run is aborted.
 */
public class MissingColumnException extends PipelineException {
    private final Dataset dataset;
    private final String column;

    public MissingColumnException(Dataset dataset, String column, List<String> acceptedNames) {
        super(String.format("Dataset '%s' has no '%s' column (looked for %s)", dataset.sourceName(), column, acceptedNames));
        this.dataset = dataset;
        this.column = column;
    }

    public Dataset getDataset() {
        return dataset;
    }

    public String getColumn() {
        return column;
    }
}
