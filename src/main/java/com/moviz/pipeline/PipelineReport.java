package com.moviz.pipeline;

import java.util.*;

/**
 * Outcome of one pipeline run: per-dataset counts, rejections, resolution counters and table sizes.
 *
 * @param datasets        counts per input dataset, in {@link Dataset} order
 * @param rejectionCounts number of rejected records per reason, over all datasets
 * @param rejections      every rejected record, in dataset then row order
 * @param resolution      entity resolution counters
 * @param movieCount      rows in the movie table
 * @param genreCount      rows in the genre table
 * @param movieGenreCount rows in the movie_genre table
 */
public record PipelineReport(
    Map<Dataset, DatasetSummary> datasets,
    Map<RejectReason, Integer> rejectionCounts,
    List<Rejection> rejections,
    EntityResolver.ResolutionStats resolution,
    int movieCount,
    int genreCount,
    int movieGenreCount
) {
    /**
     * Row counts of one dataset through the cleaning stages.
     */
    public record DatasetSummary(int loaded, int rejected, int duplicates, int cleaned) {}

    public PipelineReport {
        datasets = Collections.unmodifiableMap(new EnumMap<>(datasets));
        rejectionCounts = Collections.unmodifiableMap(new EnumMap<>(rejectionCounts));
        rejections = List.copyOf(rejections);
    }

    /**
     * Tallies rejections per reason.
     */
    public static Map<RejectReason, Integer> countByReason(List<Rejection> rejections) {
        Map<RejectReason, Integer> counts = new EnumMap<>(RejectReason.class);
        for (Rejection rejection : rejections) {
            counts.merge(rejection.reason(), 1, Integer::sum);
        }
        return counts;
    }

    public int rejected(RejectReason reason) {
        return rejectionCounts.getOrDefault(reason, 0);
    }

    /**
     * Multi-line, human readable summary for the log.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder("Pipeline report");
        for (Map.Entry<Dataset, DatasetSummary> entry : datasets.entrySet()) {
            DatasetSummary s = entry.getValue();
            sb.append(String.format("%n  %-8s loaded=%d rejected=%d duplicates=%d cleaned=%d",
                entry.getKey().sourceName(), s.loaded(), s.rejected(), s.duplicates(), s.cleaned()));
        }
        if (!rejectionCounts.isEmpty()) {
            sb.append(String.format("%n  rejections: %s", rejectionCounts));
        }
        sb.append(String.format("%n  resolution: %d by identifier, %d by title+year, %d metadata-only, %d genre-only",
            resolution.identifierMatches(), resolution.fallbackMatches(), resolution.metadataOnly(), resolution.genresOnly()));
        sb.append(String.format("%n  financial: %d matched, %d unmatched; collisions: %d",
            resolution.financialMatches(), resolution.unmatchedFinancial(), resolution.collisions()));
        sb.append(String.format("%n  tables: movie=%d genre=%d movie_genre=%d", movieCount, genreCount, movieGenreCount));
        return sb.toString();
    }
}
