package com.moviz.pipeline;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical per-source representation of one dataset row.
 * <p>
 * {@code normalizedTitle} is always {@link TitleNormalizer#normalize(String)} of {@code title}, and
 * {@code decade} is filled in by {@link Augmenter} from {@code year}. Typed payload fields are null when
 * the dataset lacks the column or the cell is blank.
 * <p>
 * {@code columns} holds every unified column found in the dataset header with its raw value (null when
 * blank). {@link QualityFilter} counts missingness over it.
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public record NormalizedRecord(
    Dataset dataset,
    int rowNumber,
    String rawId,
    String title,
    String normalizedTitle,
    Integer year,
    Integer decade,
    LocalDate releaseDate,
    Double rating,
    Long votes,
    Integer runtime,
    Double popularity,
    Certificate certificate,
    List<String> genres,
    Long productionBudget,
    Long domesticGross,
    Long worldwideGross,
    boolean adult,
    String status,
    String description,
    Map<String, String> columns
) {
    public NormalizedRecord {
        genres = genres == null ? List.of() : List.copyOf(genres);
        columns = columns == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    /**
     * @return the fallback key, or null while title or year is missing
     */
    public FallbackKey fallbackKey() {
        if (normalizedTitle == null || normalizedTitle.isEmpty() || year == null) return null;
        return new FallbackKey(normalizedTitle, year);
    }

    public boolean hasRawId() {
        return rawId != null && !rawId.isBlank();
    }

    public NormalizedRecord withDecade(int newDecade) {
        return new NormalizedRecord(dataset, rowNumber, rawId, title, normalizedTitle, year, newDecade, releaseDate,
            rating, votes, runtime, popularity, certificate, genres, productionBudget, domesticGross, worldwideGross,
            adult, status, description, columns);
    }
}
