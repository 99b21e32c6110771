package com.moviz.pipeline;

import java.util.EnumSet;
import java.util.Set;

/**
 * A resolved film: one row of the {@code movie} table. Created by {@link EntityResolver} and never
 * modified afterwards.
 * <p>
 * Financial fields are null unless a financial record matched this movie on its fallback key.
 * {@code provenance} lists the datasets that contributed; it always contains {@link Dataset#METADATA}
 * or {@link Dataset#GENRES}.
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public record Movie(
    long movieId,
    String sourceId,
    String title,
    String normalizedTitle,
    int year,
    int decade,
    Certificate certificate,
    Double rating,
    Long votes,
    Integer runtime,
    String description,
    Long productionBudget,
    Long domesticGross,
    Long worldwideGross,
    Set<Dataset> provenance
) {
    public Movie {
        provenance = Set.copyOf(EnumSet.copyOf(provenance));
    }

    public FallbackKey fallbackKey() {
        return new FallbackKey(normalizedTitle, year);
    }

    public boolean isFrom(Dataset dataset) {
        return provenance.contains(dataset);
    }

    public boolean hasFinancials() {
        return productionBudget != null || domesticGross != null || worldwideGross != null;
    }
}
