package com.moviz.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Cross-dataset entity resolution: turns the cleaned metadata, genre and financial records into
 * {@link Movie}s.
 * <p>
 * Workflow:
 * <ul>
 *   <li><b>Primary merge.</b> Metadata records join genre records on equal native identifiers first; the
 *       records left over then join on the fallback key {@code (normalizedTitle, year)}. Each genre record
 *       is used at most once. Records without a counterpart become single-source movies.</li>
 *   <li><b>Financial augmentation.</b> Financial records carry no shared identifier and match on the
 *       fallback key only: metadata-derived movies first, then genre-only movies. Financial records
 *       matching neither are dropped; they cannot establish a movie on their own.</li>
 *   <li><b>Collisions.</b> When a key has more than one candidate, the first in stable input order wins
 *       and the collision is logged. No other field is consulted.</li>
 * </ul>
 * When a record has no match the movie simply has fewer sources; it is never an error.
 * <p>
 * Movie ids are assigned from 1: metadata-derived movies in metadata order, then genre-only movies in
 * genre order, so identical inputs always produce identical ids.
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public class EntityResolver {
    private static final Logger logger = LoggerFactory.getLogger(EntityResolver.class);

    /**
     * Counters describing one resolution.
     */
    public record ResolutionStats(
        int identifierMatches,
        int fallbackMatches,
        int metadataOnly,
        int genresOnly,
        int financialMatches,
        int unmatchedFinancial,
        int collisions
    ) {}

    /**
     * Resolved movies (id order) and the counters of the run.
     */
    public record ResolutionResult(List<ResolvedMovie> movies, ResolutionStats stats) {
        public ResolutionResult {
            movies = List.copyOf(movies);
        }
    }

    // Mutable while resolution runs; frozen into a Movie at the end
    private static final class MovieDraft {
        final NormalizedRecord metadata;
        NormalizedRecord genres;
        NormalizedRecord financial;

        MovieDraft(NormalizedRecord metadata, NormalizedRecord genres) {
            this.metadata = metadata;
            this.genres = genres;
        }

        NormalizedRecord primary() {
            return metadata != null ? metadata : genres;
        }

        FallbackKey key() {
            return primary().fallbackKey();
        }
    }

    /**
     * Resolves the three cleaned datasets.
     * @param metadata  deduplicated metadata records
     * @param genres    deduplicated genre/certificate records
     * @param financial deduplicated financial records
     * @return resolved movies with their genre labels
     */
    public ResolutionResult resolve(List<NormalizedRecord> metadata, List<NormalizedRecord> genres, List<NormalizedRecord> financial) {
        int collisions = 0;
        Set<NormalizedRecord> consumed = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<FallbackKey> claimedKeys = new HashSet<>();

        // pass 1: shared native identifier
        Map<String, NormalizedRecord> genresById = new HashMap<>();
        for (NormalizedRecord record : genres) {
            if (record.hasRawId()) genresById.putIfAbsent(record.rawId(), record);
        }
        List<MovieDraft> metadataDrafts = new ArrayList<>();
        int identifierMatches = 0;
        for (NormalizedRecord record : metadata) {
            FallbackKey key = record.fallbackKey();
            if (key == null) {
                logger.warn("Skipping metadata row {} without a fallback key", record.rowNumber());
                continue;
            }
            if (!claimedKeys.add(key)) {
                collisions++;
                logger.warn("Fallback key collision: metadata row {} ({}) duplicates key {}, first record kept",
                    record.rowNumber(), record.title(), key);
                continue;
            }
            NormalizedRecord partner = null;
            if (record.hasRawId()) {
                NormalizedRecord candidate = genresById.get(record.rawId());
                if (candidate != null && !consumed.contains(candidate)) {
                    partner = candidate;
                    consumed.add(candidate);
                    identifierMatches++;
                }
            }
            metadataDrafts.add(new MovieDraft(record, partner));
        }

        // pass 2: fallback key for whatever is still unpaired
        Map<FallbackKey, List<NormalizedRecord>> genresByKey = indexByKey(genres, NormalizedRecord::fallbackKey);
        int fallbackMatches = 0;
        for (MovieDraft draft : metadataDrafts) {
            if (draft.genres != null) continue;
            List<NormalizedRecord> candidates = unconsumed(genresByKey.get(draft.key()), consumed);
            if (candidates.isEmpty()) continue;
            if (candidates.size() > 1) {
                collisions++;
                logger.warn("Ambiguous fallback match for metadata row {} on key {}: {} genre candidates, taking row {}",
                    draft.metadata.rowNumber(), draft.key(), candidates.size(), candidates.get(0).rowNumber());
            }
            draft.genres = candidates.get(0);
            consumed.add(candidates.get(0));
            fallbackMatches++;
        }

        List<MovieDraft> genreOnlyDrafts = new ArrayList<>();
        for (NormalizedRecord record : genres) {
            if (consumed.contains(record)) continue;
            FallbackKey key = record.fallbackKey();
            if (key == null) {
                logger.warn("Skipping genre row {} without a fallback key", record.rowNumber());
                continue;
            }
            if (!claimedKeys.add(key)) {
                collisions++;
                logger.warn("Fallback key collision: genre row {} ({}) has key {} already held by a resolved movie, dropped",
                    record.rowNumber(), record.title(), key);
                continue;
            }
            consumed.add(record);
            genreOnlyDrafts.add(new MovieDraft(null, record));
        }

        // financial augmentation, metadata-derived movies preferred
        Map<FallbackKey, List<MovieDraft>> metadataIndex = indexByKey(metadataDrafts, MovieDraft::key);
        Map<FallbackKey, List<MovieDraft>> genreOnlyIndex = indexByKey(genreOnlyDrafts, MovieDraft::key);
        int financialMatches = 0;
        int unmatchedFinancial = 0;
        for (NormalizedRecord record : financial) {
            FallbackKey key = record.fallbackKey();
            List<MovieDraft> candidates = key == null ? List.of() : withoutFinancials(metadataIndex.get(key));
            if (candidates.isEmpty() && key != null) {
                candidates = withoutFinancials(genreOnlyIndex.get(key));
            }
            if (candidates.isEmpty()) {
                unmatchedFinancial++;
                logger.debug("Unmatched financial record row {} ({}, {})", record.rowNumber(), record.title(), record.year());
                continue;
            }
            if (candidates.size() > 1) {
                collisions++;
                logger.warn("Ambiguous fallback match for financial row {} on key {}: {} candidates, taking the first",
                    record.rowNumber(), key, candidates.size());
            }
            candidates.get(0).financial = record;
            financialMatches++;
        }

        List<ResolvedMovie> resolved = new ArrayList<>(metadataDrafts.size() + genreOnlyDrafts.size());
        long nextId = 1;
        for (MovieDraft draft : metadataDrafts) resolved.add(freeze(draft, nextId++));
        for (MovieDraft draft : genreOnlyDrafts) resolved.add(freeze(draft, nextId++));

        ResolutionStats stats = new ResolutionStats(identifierMatches, fallbackMatches,
            metadataDrafts.size() - identifierMatches - fallbackMatches, genreOnlyDrafts.size(),
            financialMatches, unmatchedFinancial, collisions);
        logger.info("Resolved {} movies: {} joined on identifier, {} on normalized title and year, {} metadata-only, {} genre-only",
            resolved.size(), identifierMatches, fallbackMatches, stats.metadataOnly(), stats.genresOnly());
        logger.info("Financial coverage: {} matched, {} unmatched and dropped, {} collisions", financialMatches,
            unmatchedFinancial, collisions);
        return new ResolutionResult(resolved, stats);
    }

    /**
     * Pure lookup from fallback key to candidates in stable input order.
     */
    static <T> Map<FallbackKey, List<T>> indexByKey(List<T> items, Function<T, FallbackKey> keyOf) {
        Map<FallbackKey, List<T>> index = new LinkedHashMap<>();
        for (T item : items) {
            FallbackKey key = keyOf.apply(item);
            if (key != null) index.computeIfAbsent(key, k -> new ArrayList<>()).add(item);
        }
        return index;
    }

    private static List<NormalizedRecord> unconsumed(List<NormalizedRecord> candidates, Set<NormalizedRecord> consumed) {
        if (candidates == null) return List.of();
        List<NormalizedRecord> free = new ArrayList<>();
        for (NormalizedRecord candidate : candidates) {
            if (!consumed.contains(candidate)) free.add(candidate);
        }
        return free;
    }

    private static List<MovieDraft> withoutFinancials(List<MovieDraft> candidates) {
        if (candidates == null) return List.of();
        List<MovieDraft> free = new ArrayList<>();
        for (MovieDraft candidate : candidates) {
            if (candidate.financial == null) free.add(candidate);
        }
        return free;
    }

    private ResolvedMovie freeze(MovieDraft draft, long movieId) {
        NormalizedRecord primary = draft.primary();
        NormalizedRecord meta = draft.metadata;
        NormalizedRecord gen = draft.genres;
        NormalizedRecord fin = draft.financial;

        EnumSet<Dataset> provenance = EnumSet.noneOf(Dataset.class);
        if (meta != null) provenance.add(Dataset.METADATA);
        if (gen != null) provenance.add(Dataset.GENRES);
        if (fin != null) provenance.add(Dataset.FINANCIAL);

        LinkedHashSet<String> labels = new LinkedHashSet<>();
        if (meta != null) labels.addAll(meta.genres());
        if (gen != null) labels.addAll(gen.genres());

        Movie movie = new Movie(
            movieId,
            firstNonNull(meta == null ? null : meta.rawId(), gen == null ? null : gen.rawId()),
            primary.title(),
            primary.normalizedTitle(),
            primary.year(),
            Augmenter.decadeOf(primary.year()),
            firstNonNull(meta == null ? null : meta.certificate(), gen == null ? null : gen.certificate()),
            firstNonNull(meta == null ? null : meta.rating(), gen == null ? null : gen.rating()),
            firstNonNull(meta == null ? null : meta.votes(), gen == null ? null : gen.votes()),
            firstNonNull(meta == null ? null : meta.runtime(), gen == null ? null : gen.runtime()),
            firstNonNull(meta == null ? null : meta.description(), gen == null ? null : gen.description()),
            fin == null ? null : fin.productionBudget(),
            fin == null ? null : fin.domesticGross(),
            fin == null ? null : fin.worldwideGross(),
            provenance
        );
        return new ResolvedMovie(movie, new ArrayList<>(labels));
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
