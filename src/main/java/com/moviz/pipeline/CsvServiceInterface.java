package com.moviz.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV input and output of the pipeline.
 */
public interface CsvServiceInterface {
    /**
     * Loads a raw dataset.
     * @param dataset which catalog is being loaded
     * @param source  a CSV file, or a directory whose {@code *.csv} files are stacked in file-name order
     * @return header and rows
     * @throws IOException if the source is missing or unreadable
     */
    RawDataset readDataset(Dataset dataset, Path source) throws IOException;

    /**
     * Writes the movie, genre and movie_genre tables as {@code movies.csv}, {@code genres.csv} and
     * {@code movie_genres.csv}.
     * @param schema    tables to export
     * @param outputDir target directory, created if needed
     * @throws IOException if writing fails
     */
    void writeSchema(RelationalSchema schema, Path outputDir) throws IOException;

    /**
     * Writes rejected records to {@code rejections.csv}.
     * @param rejections rejected records
     * @param outputDir  target directory, created if needed
     * @throws IOException if writing fails
     */
    void writeRejections(List<Rejection> rejections, Path outputDir) throws IOException;
}
