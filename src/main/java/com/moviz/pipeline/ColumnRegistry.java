package com.moviz.pipeline;

import java.util.*;

/**
 * Central registry of the unified columns of every dataset, their source aliases and their
 * critical / non-critical classification.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link Normalizer} resolves each dataset header against this registry once per run, which
 *       unifies the heterogeneous source column names.</li>
 *   <li>{@link QualityFilter} reads the classification to decide which nulls reject a record outright
 *       and which count towards the missingness threshold.</li>
 * </ul>
 * Add a column here and both consumers pick it up.
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public final class ColumnRegistry {
    private ColumnRegistry() {}

    public static final String RAW_ID = "raw_id";
    public static final String TITLE = "title";
    public static final String RELEASE_DATE = "release_date";
    public static final String RATING = "rating";
    public static final String VOTES = "votes";
    public static final String POPULARITY = "popularity";
    public static final String GENRE = "genre";
    public static final String STATUS = "status";
    public static final String RUNTIME = "runtime";
    public static final String ADULT = "adult";
    public static final String BUDGET = "budget";
    public static final String REVENUE = "revenue";
    public static final String DESCRIPTION = "description";
    public static final String LANGUAGE = "language";
    public static final String PRODUCTION_COUNTRIES = "production_countries";
    public static final String CERTIFICATE = "certificate";
    public static final String DIRECTOR = "director";
    public static final String STAR = "star";
    public static final String TOTAL_GROSS = "total_gross";
    public static final String PRODUCTION_BUDGET = "production_budget";
    public static final String DOMESTIC_GROSS = "domestic_gross";
    public static final String WORLDWIDE_GROSS = "worldwide_gross";

    private static final Map<Dataset, List<ColumnField>> FIELDS = new EnumMap<>(Dataset.class);

    static {
        FIELDS.put(Dataset.METADATA, List.of(
            new ColumnField(RAW_ID, List.of("imdb_id", "movie_id", "id"), ColumnRole.KEY),
            new ColumnField(TITLE, List.of("title", "movie_name"), ColumnRole.CRITICAL),
            new ColumnField(RELEASE_DATE, List.of("release_date", "date", "year"), ColumnRole.CRITICAL),
            new ColumnField(RATING, List.of("vote_average", "rating"), ColumnRole.NON_CRITICAL),
            new ColumnField(VOTES, List.of("vote_count", "votes"), ColumnRole.NON_CRITICAL),
            new ColumnField(POPULARITY, List.of("popularity"), ColumnRole.NON_CRITICAL),
            new ColumnField(GENRE, List.of("genres", "genre"), ColumnRole.NON_CRITICAL),
            new ColumnField(STATUS, List.of("status"), ColumnRole.NON_CRITICAL),
            new ColumnField(RUNTIME, List.of("runtime"), ColumnRole.NON_CRITICAL),
            new ColumnField(ADULT, List.of("adult"), ColumnRole.NON_CRITICAL),
            new ColumnField(BUDGET, List.of("budget"), ColumnRole.NON_CRITICAL),
            new ColumnField(REVENUE, List.of("revenue"), ColumnRole.NON_CRITICAL),
            new ColumnField(DESCRIPTION, List.of("overview", "description"), ColumnRole.NON_CRITICAL),
            new ColumnField(LANGUAGE, List.of("original_language", "language"), ColumnRole.NON_CRITICAL),
            new ColumnField(PRODUCTION_COUNTRIES, List.of("production_countries"), ColumnRole.NON_CRITICAL)
        ));
        FIELDS.put(Dataset.GENRES, List.of(
            new ColumnField(RAW_ID, List.of("movie_id", "imdb_id", "id"), ColumnRole.KEY),
            new ColumnField(TITLE, List.of("movie_name", "title"), ColumnRole.CRITICAL),
            new ColumnField(RELEASE_DATE, List.of("year", "release_date", "date"), ColumnRole.CRITICAL),
            new ColumnField(CERTIFICATE, List.of("certificate"), ColumnRole.NON_CRITICAL),
            new ColumnField(RUNTIME, List.of("runtime"), ColumnRole.NON_CRITICAL),
            new ColumnField(GENRE, List.of("genre", "genres"), ColumnRole.NON_CRITICAL),
            new ColumnField(RATING, List.of("rating"), ColumnRole.NON_CRITICAL),
            new ColumnField(VOTES, List.of("votes"), ColumnRole.NON_CRITICAL),
            new ColumnField(DESCRIPTION, List.of("description"), ColumnRole.NON_CRITICAL),
            new ColumnField(DIRECTOR, List.of("director"), ColumnRole.NON_CRITICAL),
            new ColumnField(STAR, List.of("star"), ColumnRole.NON_CRITICAL),
            new ColumnField(TOTAL_GROSS, List.of("gross(in $)", "total_gross"), ColumnRole.NON_CRITICAL)
        ));
        FIELDS.put(Dataset.FINANCIAL, List.of(
            new ColumnField(TITLE, List.of("Movie", "title"), ColumnRole.CRITICAL),
            new ColumnField(RELEASE_DATE, List.of("Release Date", "release_date", "year", "date"), ColumnRole.CRITICAL),
            new ColumnField(PRODUCTION_BUDGET, List.of("Production Budget", "production_budget", "budget"), ColumnRole.NON_CRITICAL),
            new ColumnField(DOMESTIC_GROSS, List.of("Domestic Gross", "domestic_gross"), ColumnRole.NON_CRITICAL),
            new ColumnField(WORLDWIDE_GROSS, List.of("Worldwide Gross", "worldwide_gross"), ColumnRole.NON_CRITICAL)
        ));
    }

    /**
     * Returns the unified columns of a dataset in declaration order.
     */
    public static List<ColumnField> getFields(Dataset dataset) {
        return FIELDS.get(dataset);
    }

    /**
     * Returns the ColumnField with the given canonical name, or null if the dataset does not declare it.
     */
    public static ColumnField getField(Dataset dataset, String name) {
        for (ColumnField f : FIELDS.get(dataset)) if (f.fieldName.equals(name)) return f;
        return null;
    }

    /**
     * Resolves a dataset header to a mapping of canonical column name to source column name.
     * Header cells are compared case-insensitively after trimming. Columns absent from the header are
     * omitted from the result.
     *
     * @param dataset dataset the header belongs to
     * @param header  source column names
     * @return canonical name to source column name, in registry order
     * @throws MissingColumnException if the header has no title column or no date-like column
     */
    public static Map<String, String> resolveHeader(Dataset dataset, List<String> header) {
        Map<String, String> byLowerCase = new LinkedHashMap<>();
        for (String column : header) {
            if (column == null) continue;
            byLowerCase.putIfAbsent(column.trim().toLowerCase(Locale.ROOT), column);
        }
        Map<String, String> mapping = new LinkedHashMap<>();
        for (ColumnField field : FIELDS.get(dataset)) {
            for (String alias : field.aliases) {
                String source = byLowerCase.get(alias.toLowerCase(Locale.ROOT));
                if (source != null) {
                    mapping.put(field.fieldName, source);
                    break;
                }
            }
        }
        if (!mapping.containsKey(TITLE)) {
            throw new MissingColumnException(dataset, TITLE, getField(dataset, TITLE).aliases);
        }
        if (!mapping.containsKey(RELEASE_DATE)) {
            throw new MissingColumnException(dataset, RELEASE_DATE, getField(dataset, RELEASE_DATE).aliases);
        }
        return mapping;
    }
}
