package com.moviz.pipeline;

/**
 * Interface for the relational store receiving the pipeline output.
 */
public interface PostgresServiceInterface {
    /**
     * Creates the target schema and empty movie, genre and movie_genre tables if they don't already exist.
     */
    void createTables();

    /**
     * Replaces the stored tables with the given ones in a single transaction. On failure the previously
     * stored tables stay untouched.
     * @param schema tables of one run
     * @throws PipelineException if the write fails
     */
    void writeSchema(RelationalSchema schema);

    /**
     * Counts the rows of one stored table.
     * @param table {@code movie}, {@code genre} or {@code movie_genre}
     * @return row count
     * @throws PipelineException if the query fails
     */
    long countRows(String table);
}
