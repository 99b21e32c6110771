package com.moviz.pipeline;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Service for reading raw datasets and exporting processed tables using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Reads a single CSV file, or stacks every {@code *.csv} file of a directory in file-name order.
 *       The header is the union of all file headers in first-seen order; cells a file lacks are null.</li>
 *   <li>Row numbers run from 1 across all stacked files, so rejections can be traced back.</li>
 *   <li>Writes each processed table to a temporary file first and moves it into place, so readers never
 *       see a half-written export.</li>
 * </ul>
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    public static final String MOVIES_FILE = "movies.csv";
    public static final String GENRES_FILE = "genres.csv";
    public static final String MOVIE_GENRES_FILE = "movie_genres.csv";
    public static final String REJECTIONS_FILE = "rejections.csv";

    // Column order of the exported tables (matches PostgresService)
    static final List<String> MOVIE_COLUMNS = List.of(
        "movie_id", "source_id", "title", "normalized_title", "year", "decade", "certificate",
        "rating", "votes", "runtime", "description", "production_budget", "domestic_gross",
        "worldwide_gross", "in_metadata", "in_genres", "in_financial"
    );
    static final List<String> GENRE_COLUMNS = List.of("genre_id", "genre_name");
    static final List<String> MOVIE_GENRE_COLUMNS = List.of("movie_id", "genre_id");
    static final List<String> REJECTION_COLUMNS = List.of("dataset", "row_number", "title", "reason", "detail");

    private static final char BOM = '\uFEFF';

    @Override
    public RawDataset readDataset(Dataset dataset, Path source) throws IOException {
        if (dataset == null || source == null) {
            throw new IllegalArgumentException("Dataset and source path are required");
        }
        List<Path> files = listInputFiles(source);
        LinkedHashSet<String> header = new LinkedHashSet<>();
        List<RawRecord> rows = new ArrayList<>();
        for (Path file : files) {
            readFile(dataset, file, header, rows);
        }
        logger.info("Loaded {} rows for '{}' from {} file(s) under {}", rows.size(), dataset.sourceName(), files.size(), source);
        return new RawDataset(dataset, new ArrayList<>(header), rows);
    }

    /**
     * Resolves the input files of a dataset.
     * @param source file or directory
     * @return CSV files in file-name order
     * @throws IOException if the source does not exist or a directory holds no CSV file
     */
    static List<Path> listInputFiles(Path source) throws IOException {
        if (Files.isRegularFile(source)) {
            return List.of(source);
        }
        if (!Files.isDirectory(source)) {
            throw new IOException("Input not found: " + source);
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(source)) {
            files = entries
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .collect(Collectors.toList());
        }
        if (files.isEmpty()) {
            throw new IOException("No CSV files in directory: " + source);
        }
        return files;
    }

    private void readFile(Dataset dataset, Path file, Set<String> header, List<RawRecord> rows) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReaderBuilder(reader).withCSVParser(new RFC4180ParserBuilder().build()).build()) {
            String[] fileHeader = csv.readNext();
            if (fileHeader == null) {
                logger.warn("Skipping empty CSV file {}", file);
                return;
            }
            if (fileHeader.length > 0 && !fileHeader[0].isEmpty() && fileHeader[0].charAt(0) == BOM) {
                fileHeader[0] = fileHeader[0].substring(1);
            }
            for (int i = 0; i < fileHeader.length; i++) {
                fileHeader[i] = fileHeader[i].strip();
                header.add(fileHeader[i]);
            }
            String[] cells;
            int before = rows.size();
            while ((cells = csv.readNext()) != null) {
                if (cells.length == 1 && cells[0].isBlank()) continue;
                Map<String, String> values = new LinkedHashMap<>();
                for (int i = 0; i < fileHeader.length; i++) {
                    values.put(fileHeader[i], i < cells.length ? cells[i] : null);
                }
                rows.add(new RawRecord(dataset, rows.size() + 1, values));
            }
            logger.debug("Read {} rows from {}", rows.size() - before, file);
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV in " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void writeSchema(RelationalSchema schema, Path outputDir) throws IOException {
        if (schema == null) {
            throw new IllegalArgumentException("Schema cannot be null");
        }
        Files.createDirectories(outputDir);

        List<String[]> movieRows = new ArrayList<>(schema.movies().size());
        for (Movie movie : schema.movies()) {
            movieRows.add(new String[]{
                Long.toString(movie.movieId()),
                safe(movie.sourceId()),
                safe(movie.title()),
                safe(movie.normalizedTitle()),
                Integer.toString(movie.year()),
                Integer.toString(movie.decade()),
                movie.certificate() == null ? "" : movie.certificate().label(),
                safe(movie.rating()),
                safe(movie.votes()),
                safe(movie.runtime()),
                safe(movie.description()),
                safe(movie.productionBudget()),
                safe(movie.domesticGross()),
                safe(movie.worldwideGross()),
                Boolean.toString(movie.isFrom(Dataset.METADATA)),
                Boolean.toString(movie.isFrom(Dataset.GENRES)),
                Boolean.toString(movie.isFrom(Dataset.FINANCIAL))
            });
        }
        writeTable(outputDir.resolve(MOVIES_FILE), MOVIE_COLUMNS, movieRows);

        List<String[]> genreRows = new ArrayList<>(schema.genres().size());
        for (Genre genre : schema.genres()) {
            genreRows.add(new String[]{Integer.toString(genre.genreId()), genre.name()});
        }
        writeTable(outputDir.resolve(GENRES_FILE), GENRE_COLUMNS, genreRows);

        List<String[]> linkRows = new ArrayList<>(schema.movieGenres().size());
        for (MovieGenre link : schema.movieGenres()) {
            linkRows.add(new String[]{Long.toString(link.movieId()), Integer.toString(link.genreId())});
        }
        writeTable(outputDir.resolve(MOVIE_GENRES_FILE), MOVIE_GENRE_COLUMNS, linkRows);
        logger.info("Exported {} movies, {} genres and {} movie-genre links to {}", movieRows.size(),
            genreRows.size(), linkRows.size(), outputDir);
    }

    @Override
    public void writeRejections(List<Rejection> rejections, Path outputDir) throws IOException {
        if (rejections == null) {
            throw new IllegalArgumentException("Rejection list cannot be null");
        }
        Files.createDirectories(outputDir);
        List<String[]> rows = new ArrayList<>(rejections.size());
        for (Rejection r : rejections) {
            rows.add(new String[]{r.dataset().sourceName(), Integer.toString(r.rowNumber()), safe(r.title()),
                r.reason().name(), safe(r.detail())});
        }
        writeTable(outputDir.resolve(REJECTIONS_FILE), REJECTION_COLUMNS, rows);
        logger.info("Wrote {} rejections to {}", rows.size(), outputDir.resolve(REJECTIONS_FILE));
    }

    private static void writeTable(Path target, List<String> columns, List<String[]> rows) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(columns.toArray(String[]::new));
            writer.writeAll(rows);
        }
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, replacing instead", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String safe(Object value) {
        return value == null ? "" : value.toString();
    }
}
