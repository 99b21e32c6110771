package com.moviz.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Run settings. Each key is read from a JVM system property first, then from the environment, then
 * falls back to its default.
 *
 * @param metadataPath  TMDB export, file or directory ({@code MOVIZ_TMDB_PATH})
 * @param genresPath    genre/certificate export ({@code MOVIZ_GENRES_PATH})
 * @param financialPath budgets export ({@code MOVIZ_BUDGETS_PATH})
 * @param outputDir     processed CSV directory ({@code MOVIZ_OUTPUT_DIR})
 * @param exportCsv     whether processed CSVs are written ({@code MOVIZ_EXPORT_CSV})
 * @param dbUrl         external JDBC URL, null to use embedded Postgres ({@code MOVIZ_DB_URL})
 * @param dbUser        database user ({@code MOVIZ_DB_USER})
 * @param dbPassword    database password ({@code MOVIZ_DB_PASSWORD})
 * @param dbSchema      target schema ({@code MOVIZ_DB_SCHEMA})
 * @param embeddedPort  embedded Postgres port ({@code EMBEDDED_PG_PORT})
 * @param embeddedDataDir embedded Postgres data directory ({@code EMBEDDED_PG_DATA_DIR})
 */
public record PipelineConfig(
    Path metadataPath,
    Path genresPath,
    Path financialPath,
    Path outputDir,
    boolean exportCsv,
    String dbUrl,
    String dbUser,
    String dbPassword,
    String dbSchema,
    int embeddedPort,
    String embeddedDataDir
) {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String TMDB_PATH = "MOVIZ_TMDB_PATH";
    public static final String GENRES_PATH = "MOVIZ_GENRES_PATH";
    public static final String BUDGETS_PATH = "MOVIZ_BUDGETS_PATH";
    public static final String OUTPUT_DIR = "MOVIZ_OUTPUT_DIR";
    public static final String EXPORT_CSV = "MOVIZ_EXPORT_CSV";
    public static final String DB_URL = "MOVIZ_DB_URL";
    public static final String DB_USER = "MOVIZ_DB_USER";
    public static final String DB_PASSWORD = "MOVIZ_DB_PASSWORD";
    public static final String DB_SCHEMA = "MOVIZ_DB_SCHEMA";
    public static final String EMBEDDED_PG_PORT = "EMBEDDED_PG_PORT";
    public static final String EMBEDDED_PG_DATA_DIR = "EMBEDDED_PG_DATA_DIR";

    static final int DEFAULT_PORT = 5432;

    public static PipelineConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Resolves the configuration against the given environment; system properties still take precedence.
     * @param env environment variables
     * @return resolved configuration
     */
    static PipelineConfig fromEnvironment(Map<String, String> env) {
        String portStr = setting(env, EMBEDDED_PG_PORT, Integer.toString(DEFAULT_PORT));
        int port = DEFAULT_PORT;
        try {
            port = Integer.parseInt(portStr.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} '{}', using {}", EMBEDDED_PG_PORT, portStr, DEFAULT_PORT);
        }
        return new PipelineConfig(
            Paths.get(setting(env, TMDB_PATH, "data/raw/tmdb_movies")),
            Paths.get(setting(env, GENRES_PATH, "data/raw/genres")),
            Paths.get(setting(env, BUDGETS_PATH, "data/raw/budgets")),
            Paths.get(setting(env, OUTPUT_DIR, "data/processed")),
            Boolean.parseBoolean(setting(env, EXPORT_CSV, "true").trim()),
            Utils.blankToNull(setting(env, DB_URL, null)),
            setting(env, DB_USER, "postgres"),
            setting(env, DB_PASSWORD, "postgres"),
            setting(env, DB_SCHEMA, PostgresService.DEFAULT_SCHEMA),
            port,
            setting(env, EMBEDDED_PG_DATA_DIR, "data/pgdata")
        );
    }

    private static String setting(Map<String, String> env, String key, String defaultValue) {
        return System.getProperty(key, env.getOrDefault(key, defaultValue));
    }

    public boolean useEmbeddedDatabase() {
        return dbUrl == null;
    }
}
