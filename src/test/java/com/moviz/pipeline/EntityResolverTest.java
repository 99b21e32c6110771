package com.moviz.pipeline;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class EntityResolverTest {
    private final EntityResolver resolver = new EntityResolver();

    @Test
    void testIdentifierJoinMergesMetadataAndGenres() {
        NormalizedRecord metadata = Records.metadata(1, "42", "The Matrix", 1999).build();
        NormalizedRecord genres = Records.genres(1, "42", "The Matrix", 1999, "Action", "Sci-Fi").build();
        EntityResolver.ResolutionResult result = resolver.resolve(List.of(metadata), List.of(genres), List.of());

        assertEquals(1, result.movies().size());
        ResolvedMovie resolved = result.movies().get(0);
        assertEquals(1999, resolved.movie().year());
        assertEquals(1990, resolved.movie().decade());
        assertEquals(List.of("Action", "Sci-Fi"), resolved.genreLabels());
        assertEquals(Set.of(Dataset.METADATA, Dataset.GENRES), resolved.movie().provenance());
        assertEquals(1, result.stats().identifierMatches());
        assertEquals(0, result.stats().fallbackMatches());
    }

    @Test
    void testIdentifierJoinWinsOverDifferentTitles() {
        NormalizedRecord metadata = Records.metadata(1, "tt7", "Heat", 1995).build();
        NormalizedRecord genres = Records.genres(1, "tt7", "Heat (Remastered)", 1995, "Crime").build();
        EntityResolver.ResolutionResult result = resolver.resolve(List.of(metadata), List.of(genres), List.of());

        assertEquals(1, result.movies().size());
        assertEquals("Heat", result.movies().get(0).movie().title());
        assertEquals(List.of("Crime"), result.movies().get(0).genreLabels());
    }

    @Test
    void testFallbackKeyJoinWithoutSharedIdentifier() {
        NormalizedRecord metadata = Records.metadata(1, null, "Inception", 2010).build();
        NormalizedRecord genres = Records.genres(1, "tt1375666", "INCEPTION", 2010, "Thriller").build();
        EntityResolver.ResolutionResult result = resolver.resolve(List.of(metadata), List.of(genres), List.of());

        assertEquals(1, result.movies().size());
        assertEquals("tt1375666", result.movies().get(0).movie().sourceId());
        assertEquals(1, result.stats().fallbackMatches());
    }

    @Test
    void testFinancialAugmentationByFallbackKey() {
        NormalizedRecord metadata = Records.metadata(1, null, "Inception", 2010).build();
        NormalizedRecord financial = Records.financial(1, "inception", 2010, 160_000_000L).build();
        EntityResolver.ResolutionResult result = resolver.resolve(List.of(metadata), List.of(), List.of(financial));

        Movie movie = result.movies().get(0).movie();
        assertEquals(160_000_000L, movie.productionBudget());
        assertTrue(movie.isFrom(Dataset.FINANCIAL));
        assertEquals(1, result.stats().financialMatches());
    }

    @Test
    void testFinancialFallsBackToGenreOnlyMovie() {
        NormalizedRecord metadata = Records.metadata(1, "tt1", "Alien", 1979).build();
        NormalizedRecord genreOnly = Records.genres(1, "tt2", "Heat", 1995, "Crime").build();
        NormalizedRecord financial = Records.financial(1, "Heat", 1995, 60_000_000L).build();
        EntityResolver.ResolutionResult result = resolver.resolve(List.of(metadata), List.of(genreOnly), List.of(financial));

        assertEquals(2, result.movies().size());
        Movie alien = result.movies().get(0).movie();
        Movie heat = result.movies().get(1).movie();
        assertNull(alien.productionBudget());
        assertEquals(60_000_000L, heat.productionBudget());
        assertEquals(EnumSet.of(Dataset.GENRES, Dataset.FINANCIAL), EnumSet.copyOf(heat.provenance()));
    }

    @Test
    void testUnmatchedFinancialRecordIsDroppedAndCounted() {
        NormalizedRecord metadata = Records.metadata(1, "tt1", "Alien", 1979).build();
        NormalizedRecord financial = Records.financial(1, "Nobody Knows This", 2015, 1_000_000L).build();
        EntityResolver.ResolutionResult result = resolver.resolve(List.of(metadata), List.of(), List.of(financial));

        assertEquals(1, result.movies().size());
        assertFalse(result.movies().get(0).movie().isFrom(Dataset.FINANCIAL));
        assertEquals(0, result.stats().financialMatches());
        assertEquals(1, result.stats().unmatchedFinancial());
    }

    @Test
    void testMetadataValuesWinAndGenreValuesFillGaps() {
        NormalizedRecord metadata = Records.metadata(1, "tt1", "Heat", 1995).rating(8.3).build();
        NormalizedRecord genres = Records.genres(1, "tt1", "Heat", 1995, "Crime")
            .rating(7.0).certificate(Certificate.R).description("A heist.").build();
        Movie movie = resolver.resolve(List.of(metadata), List.of(genres), List.of()).movies().get(0).movie();

        assertEquals(8.3, movie.rating());
        assertEquals(Certificate.R, movie.certificate());
        assertEquals("A heist.", movie.description());
    }

    @Test
    void testAmbiguousFallbackMatchTakesFirstCandidate() {
        NormalizedRecord metadata = Records.metadata(1, null, "Crash", 2004).build();
        NormalizedRecord firstGenre = Records.genres(1, null, "Crash", 2004, "Drama").build();
        NormalizedRecord secondGenre = Records.genres(2, null, "Crash!", 2004, "Thriller").build();
        EntityResolver.ResolutionResult result =
            resolver.resolve(List.of(metadata), List.of(firstGenre, secondGenre), List.of());

        assertEquals(1, result.movies().size());
        assertEquals(List.of("Drama"), result.movies().get(0).genreLabels());
        // one ambiguous match, one genre record dropped for a key already held
        assertEquals(2, result.stats().collisions());
    }

    @Test
    void testMovieIdsFollowMetadataThenGenreOrder() {
        List<NormalizedRecord> metadata = List.of(
            Records.metadata(1, "b", "Brazil", 1985).build(),
            Records.metadata(2, "a", "Alien", 1979).build());
        List<NormalizedRecord> genres = List.of(
            Records.genres(1, "c", "Casablanca", 1942, "Romance").build(),
            Records.genres(2, "a", "Alien", 1979, "Horror").build());
        List<ResolvedMovie> movies = resolver.resolve(metadata, genres, List.of()).movies();

        assertEquals(List.of("Brazil", "Alien", "Casablanca"), movies.stream().map(m -> m.movie().title()).toList());
        assertEquals(List.of(1L, 2L, 3L), movies.stream().map(m -> m.movie().movieId()).toList());
    }

    @Test
    void testResolutionIsDeterministic() {
        List<NormalizedRecord> metadata = List.of(
            Records.metadata(1, "a", "Alien", 1979).build(),
            Records.metadata(2, null, "Up", 2009).build());
        List<NormalizedRecord> genres = List.of(Records.genres(1, "x", "up", 2009, "Animation").build());
        List<NormalizedRecord> financial = List.of(Records.financial(1, "Alien", 1979, 11_000_000L).build());

        assertEquals(resolver.resolve(metadata, genres, financial), resolver.resolve(metadata, genres, financial));
    }

    @Test
    void testNoTwoMoviesShareAFallbackKey() {
        List<NormalizedRecord> metadata = List.of(
            Records.metadata(1, "a", "Alien", 1979).build(),
            Records.metadata(2, "b", "Aliens", 1986).build());
        List<NormalizedRecord> genres = List.of(
            Records.genres(1, "z", "Aliens", 1986, "Action").build(),
            Records.genres(2, "y", "Alien", 1979, "Horror").build(),
            Records.genres(3, "x", "Alien 3", 1992, "Horror").build());
        List<ResolvedMovie> movies = resolver.resolve(metadata, genres, List.of()).movies();

        Set<FallbackKey> keys = new HashSet<>();
        for (ResolvedMovie resolved : movies) {
            assertTrue(keys.add(resolved.movie().fallbackKey()));
        }
        assertEquals(3, movies.size());
    }

    @Test
    void testFinancialFieldsOnlyComeFromFinancialDataset() {
        NormalizedRecord metadata = Records.metadata(1, "a", "Alien", 1979).build();
        NormalizedRecord genres = Records.genres(1, "b", "Brazil", 1985, "Comedy").build();
        NormalizedRecord financial = Records.financial(1, "Alien", 1979, 11_000_000L).worldwideGross(104_931_801L).build();
        List<ResolvedMovie> movies = resolver.resolve(List.of(metadata), List.of(genres), List.of(financial)).movies();

        for (ResolvedMovie resolved : movies) {
            Movie movie = resolved.movie();
            assertEquals(movie.isFrom(Dataset.FINANCIAL), movie.hasFinancials());
        }
        assertEquals(104_931_801L, movies.get(0).movie().worldwideGross());
        assertNull(movies.get(1).movie().worldwideGross());
    }
}
