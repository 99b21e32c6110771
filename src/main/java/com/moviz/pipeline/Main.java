package com.moviz.pipeline;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Main entry point for the MoVIZ data pipeline.
 * This application cleans and reconciles the raw movie datasets and stores the resulting tables in
 * PostgreSQL, optionally exporting them as CSV files.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code run} (default): full pipeline.</li>
 *   <li>{@code db}: start the embedded Postgres only, for inspecting the stored tables.</li>
 * </ul>
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Creates a PostgresService and ensures tables exist.
     * @param url JDBC URL
     * @param config run settings (credentials and schema)
     * @return PostgresServiceInterface
     */
    private static PostgresServiceInterface createPostgresService(String url, PipelineConfig config) {
        PostgresService postgresService = new PostgresService(url, config.dbUser(), config.dbPassword(), config.dbSchema());
        postgresService.createTables();
        return postgresService;
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments: optional mode ({@code run} or {@code db})
     */
    public static void main(String[] args) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase(Locale.ROOT) : "run";
        PipelineConfig config = PipelineConfig.fromEnvironment();
        EmbeddedPostgres postgres = null;
        boolean failed = false;
        try {
            String dbUrl = config.dbUrl();
            if (config.useEmbeddedDatabase() || mode.equals("db")) {
                postgres = PostgresService.startEmbedded(config.embeddedDataDir(), config.embeddedPort());
                dbUrl = PostgresService.jdbcUrl(postgres);
            }
            PostgresServiceInterface postgresService = createPostgresService(dbUrl, config);

            switch (mode) {
                case "db":
                    System.out.println("Embedded Postgres started.");
                    System.out.println("JDBC URL: " + dbUrl);
                    System.out.println("DB user: " + config.dbUser());
                    System.out.println("Schema: " + config.dbSchema());
                    System.out.println("Data directory: " + config.embeddedDataDir());
                    System.out.println("Press Enter to stop the embedded DB and exit.");
                    try {
                        System.in.read();
                    } catch (Exception e) {
                        logger.debug("Stopped waiting for input: {}", e.getMessage());
                    }
                    break;
                case "run":
                    MovieDataPipeline pipeline = MovieDataPipeline.create(new CsvService(), postgresService);
                    PipelineReport report = pipeline.run(config);
                    logger.info("Pipeline complete: {} movies, {} genres, {} movie-genre links", report.movieCount(),
                        report.genreCount(), report.movieGenreCount());
                    break;
                default:
                    logger.error("Unknown mode '{}'. Use 'run' or 'db'.", mode);
                    failed = true;
            }
        } catch (MissingColumnException e) {
            logger.error("Aborted, dataset '{}' is missing column '{}': {}", e.getDataset().sourceName(), e.getColumn(), e.getMessage());
            failed = true;
        } catch (Exception e) {
            logger.error("Pipeline failed: {}", e.getMessage(), e);
            failed = true;
        } finally {
            if (postgres != null) {
                try {
                    postgres.close();
                    logger.info("Embedded PostgreSQL stopped.");
                } catch (Exception e) {
                    logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
                }
            }
        }
        if (failed) {
            System.exit(1);
        }
    }
}
