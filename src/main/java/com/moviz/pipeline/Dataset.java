package com.moviz.pipeline;

/**
 * The three source catalogs feeding the pipeline.
 * <p>
 * Only {@link #METADATA} and {@link #GENRES} can establish a movie identity; {@link #FINANCIAL}
 * records only ever augment an existing movie.
 */
public enum Dataset {
    METADATA("tmdb"),
    GENRES("genres"),
    FINANCIAL("budgets");

    private final String sourceName;

    Dataset(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * @return short name used in logs and exported file names
     */
    public String sourceName() {
        return sourceName;
    }
}
