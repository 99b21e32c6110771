package com.moviz.pipeline;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.sql.*;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Service for writing the relational tables to PostgreSQL.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Every run rebuilds the tables in a staging schema ({@code <schema>_staging}) inside one
 *       transaction: create tables, batch insert genres, movies and associations.</li>
 *   <li>The live schema is then dropped and the staging schema renamed in its place, still inside the
 *       same transaction, so readers see either the previous tables or the new ones.</li>
 *   <li>Any {@link SQLException} rolls the transaction back and surfaces as {@link PipelineException};
 *       the previous tables stay as they were.</li>
 * </ul>
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
@SuppressWarnings("SqlResolve")
public class PostgresService implements PostgresServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresService.class);

    public static final String DEFAULT_SCHEMA = "moviz";
    static final Set<String> TABLES = Set.of("movie", "genre", "movie_genre");
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,50}");
    private static final int BATCH_SIZE = 1000;

    private final String url;
    private final String user;
    private final String password;
    private final String schema;

    /**
     * Constructs a PostgresService writing to the default schema.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     */
    public PostgresService(String url, String user, String password) {
        this(url, user, password, DEFAULT_SCHEMA);
    }

    /**
     * Constructs a PostgresService with the given connection parameters and target schema.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     * @param schema target schema name (lowercase SQL identifier)
     */
    public PostgresService(String url, String user, String password, String schema) {
        if (schema == null || !IDENTIFIER.matcher(schema).matches()) {
            throw new IllegalArgumentException("Invalid schema name: " + schema);
        }
        this.url = url;
        this.user = user;
        this.password = password;
        this.schema = schema;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public void createTables() {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            for (String ddl : tableDefinitions(schema, true)) {
                stmt.execute(ddl);
            }
            logger.info("Ensured schema '{}' with movie, genre and movie_genre tables exists.", schema);
        } catch (SQLException e) {
            logger.error("Error creating tables in schema '{}': {}", schema, e.getMessage());
            throw new PipelineException("Failed to create tables in schema " + schema, e);
        }
    }

    @Override
    public void writeSchema(RelationalSchema tables) {
        if (tables == null) {
            throw new IllegalArgumentException("Schema cannot be null");
        }
        String staging = schema + "_staging";
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("DROP SCHEMA IF EXISTS " + staging + " CASCADE");
                    stmt.execute("CREATE SCHEMA " + staging);
                    for (String ddl : tableDefinitions(staging, false)) {
                        stmt.execute(ddl);
                    }
                }
                insertGenres(conn, staging, tables.genres());
                insertMovies(conn, staging, tables.movies());
                insertMovieGenres(conn, staging, tables.movieGenres());
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("DROP SCHEMA IF EXISTS " + schema + " CASCADE");
                    stmt.execute("ALTER SCHEMA " + staging + " RENAME TO " + schema);
                }
                conn.commit();
                logger.info("Swapped schema '{}': {} movies, {} genres, {} movie-genre links", schema,
                    tables.movies().size(), tables.genres().size(), tables.movieGenres().size());
            } catch (SQLException e) {
                rollback(conn);
                throw e;
            }
        } catch (SQLException e) {
            logger.error("Error writing tables to schema '{}', previous tables kept: {}", schema, e.getMessage());
            throw new PipelineException("Failed to write tables to schema " + schema, e);
        }
    }

    @Override
    public long countRows(String table) {
        if (!TABLES.contains(table)) {
            throw new IllegalArgumentException("Unknown table: " + table);
        }
        String sql = "SELECT COUNT(*) FROM " + schema + "." + table;
        try (Connection conn = connect(); Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new PipelineException("Failed to count rows of " + schema + "." + table, e);
        }
    }

    static List<String> tableDefinitions(String schemaName, boolean ifNotExists) {
        String create = ifNotExists ? "CREATE TABLE IF NOT EXISTS " : "CREATE TABLE ";
        String index = ifNotExists ? "CREATE INDEX IF NOT EXISTS " : "CREATE INDEX ";
        return List.of(
            create + schemaName + ".genre (" +
                "genre_id INTEGER PRIMARY KEY, " +
                "genre_name TEXT NOT NULL UNIQUE" +
                ")",
            create + schemaName + ".movie (" +
                "movie_id BIGINT PRIMARY KEY, " +
                "source_id TEXT, title TEXT NOT NULL, normalized_title TEXT NOT NULL, " +
                "year INTEGER NOT NULL, decade INTEGER NOT NULL, certificate TEXT, " +
                "rating DOUBLE PRECISION, votes BIGINT, runtime INTEGER, description TEXT, " +
                "production_budget BIGINT, domestic_gross BIGINT, worldwide_gross BIGINT, " +
                "in_metadata BOOLEAN NOT NULL, in_genres BOOLEAN NOT NULL, in_financial BOOLEAN NOT NULL, " +
                "UNIQUE (normalized_title, year)" +
                ")",
            create + schemaName + ".movie_genre (" +
                "movie_id BIGINT NOT NULL REFERENCES " + schemaName + ".movie(movie_id), " +
                "genre_id INTEGER NOT NULL REFERENCES " + schemaName + ".genre(genre_id), " +
                "PRIMARY KEY (movie_id, genre_id)" +
                ")",
            index + "movie_genre_genre_idx ON " + schemaName + ".movie_genre (genre_id)"
        );
    }

    private void insertGenres(Connection conn, String target, List<Genre> genres) throws SQLException {
        String sql = "INSERT INTO " + target + ".genre (genre_id, genre_name) VALUES (?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int pending = 0;
            for (Genre genre : genres) {
                ps.setInt(1, genre.genreId());
                ps.setString(2, genre.name());
                ps.addBatch();
                if (++pending % BATCH_SIZE == 0) ps.executeBatch();
            }
            ps.executeBatch();
        }
        logger.debug("Inserted {} genres into {}", genres.size(), target);
    }

    private void insertMovies(Connection conn, String target, List<Movie> movies) throws SQLException {
        String sql = "INSERT INTO " + target + ".movie (movie_id, source_id, title, normalized_title, year, decade, " +
                "certificate, rating, votes, runtime, description, production_budget, domestic_gross, worldwide_gross, " +
                "in_metadata, in_genres, in_financial) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int pending = 0;
            for (Movie movie : movies) {
                ps.setLong(1, movie.movieId());
                ps.setString(2, movie.sourceId());
                ps.setString(3, movie.title());
                ps.setString(4, movie.normalizedTitle());
                ps.setInt(5, movie.year());
                ps.setInt(6, movie.decade());
                ps.setString(7, movie.certificate() == null ? null : movie.certificate().label());
                if (movie.rating() != null) ps.setDouble(8, movie.rating()); else ps.setNull(8, Types.DOUBLE);
                if (movie.votes() != null) ps.setLong(9, movie.votes()); else ps.setNull(9, Types.BIGINT);
                if (movie.runtime() != null) ps.setInt(10, movie.runtime()); else ps.setNull(10, Types.INTEGER);
                ps.setString(11, movie.description());
                if (movie.productionBudget() != null) ps.setLong(12, movie.productionBudget()); else ps.setNull(12, Types.BIGINT);
                if (movie.domesticGross() != null) ps.setLong(13, movie.domesticGross()); else ps.setNull(13, Types.BIGINT);
                if (movie.worldwideGross() != null) ps.setLong(14, movie.worldwideGross()); else ps.setNull(14, Types.BIGINT);
                ps.setBoolean(15, movie.isFrom(Dataset.METADATA));
                ps.setBoolean(16, movie.isFrom(Dataset.GENRES));
                ps.setBoolean(17, movie.isFrom(Dataset.FINANCIAL));
                ps.addBatch();
                if (++pending % BATCH_SIZE == 0) ps.executeBatch();
            }
            ps.executeBatch();
        }
        logger.debug("Inserted {} movies into {}", movies.size(), target);
    }

    private void insertMovieGenres(Connection conn, String target, List<MovieGenre> links) throws SQLException {
        String sql = "INSERT INTO " + target + ".movie_genre (movie_id, genre_id) VALUES (?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int pending = 0;
            for (MovieGenre link : links) {
                ps.setLong(1, link.movieId());
                ps.setInt(2, link.genreId());
                ps.addBatch();
                if (++pending % BATCH_SIZE == 0) ps.executeBatch();
            }
            ps.executeBatch();
        }
        logger.debug("Inserted {} movie-genre links into {}", links.size(), target);
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            logger.warn("Rollback failed: {}", e.getMessage());
        }
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(Paths.get(dataDir))
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (Exception e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new PipelineException("Failed to start embedded PostgreSQL on port " + port, e);
        }
    }

    /**
     * JDBC URL of an embedded instance's default database.
     */
    public static String jdbcUrl(EmbeddedPostgres postgres) {
        return String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort());
    }
}
