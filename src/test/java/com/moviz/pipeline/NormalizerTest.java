package com.moviz.pipeline;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NormalizerTest {
    private static final List<String> METADATA_HEADER =
        List.of("id", "title", "release_date", "vote_average", "genres", "runtime", "adult", "status");

    private final Normalizer normalizer = new Normalizer(LookupTables.certificateMapper(), LookupTables.genreMapper());

    @Test
    void testNormalizeMetadataRow() {
        RawDataset raw = Records.raw(Dataset.METADATA, METADATA_HEADER,
            new String[]{"42", "The Matrix", "1999-03-31", "8.7", "Action, Science Fiction", "136", "False", "Released"});
        Normalizer.NormalizationResult result = normalizer.normalizeAll(raw);

        assertEquals(1, result.records().size());
        assertTrue(result.rejections().isEmpty());
        NormalizedRecord record = result.records().get(0);
        assertEquals("42", record.rawId());
        assertEquals("The Matrix", record.title());
        assertEquals("the matrix", record.normalizedTitle());
        assertEquals(1999, record.year());
        assertEquals(LocalDate.of(1999, 3, 31), record.releaseDate());
        assertEquals(8.7, record.rating());
        assertEquals(136, record.runtime());
        assertEquals(List.of("Action", "Sci-Fi"), record.genres());
        assertFalse(record.adult());
        assertEquals("Released", record.status());
        assertNull(record.certificate());
        assertNull(record.decade());
    }

    @Test
    void testColumnNamesAreUnified() {
        RawDataset raw = Records.raw(Dataset.GENRES,
            List.of("movie_id", "movie_name", "year", "certificate", "runtime", "genre", "rating", "votes"),
            new String[]{"tt0113277", "Heat", "1995", "TV-MA", "170 min", "Crime, Drama", "8.3", "700,000"});
        NormalizedRecord record = normalizer.normalizeAll(raw).records().get(0);

        assertEquals("tt0113277", record.rawId());
        assertEquals("heat", record.normalizedTitle());
        assertEquals(1995, record.year());
        assertEquals(Certificate.R, record.certificate());
        assertEquals(170, record.runtime());
        assertEquals(700_000L, record.votes());
        assertEquals(List.of("Crime", "Drama"), record.genres());
        assertTrue(record.columns().containsKey(ColumnRegistry.CERTIFICATE));
        assertFalse(record.columns().containsKey(ColumnRegistry.DIRECTOR));
    }

    @Test
    void testNormalizeFinancialRow() {
        RawDataset raw = Records.raw(Dataset.FINANCIAL,
            List.of("Release Date", "Movie", "Production Budget", "Domestic Gross", "Worldwide Gross"),
            new String[]{"Dec 18, 2009", "Avatar", "$237,000,000", "$749,766,139", "$2,923,706,026"});
        NormalizedRecord record = normalizer.normalizeAll(raw).records().get(0);

        assertNull(record.rawId());
        assertEquals(2009, record.year());
        assertEquals(LocalDate.of(2009, 12, 18), record.releaseDate());
        assertEquals(237_000_000L, record.productionBudget());
        assertEquals(749_766_139L, record.domesticGross());
        assertEquals(2_923_706_026L, record.worldwideGross());
    }

    @Test
    void testUnknownCertificateIsKept() {
        RawDataset raw = Records.raw(Dataset.GENRES, List.of("movie_id", "movie_name", "year", "certificate"),
            new String[]{"tt1", "Obscure", "1970", "Banned-in-Narnia"});
        Normalizer.NormalizationResult result = normalizer.normalizeAll(raw);

        assertEquals(1, result.records().size());
        assertEquals(Certificate.UNKNOWN, result.records().get(0).certificate());
    }

    @Test
    void testMalformedNumberRejectsRecord() {
        RawDataset raw = Records.raw(Dataset.METADATA, METADATA_HEADER,
            new String[]{"1", "Good", "2001-01-01", "7.1", "Drama", "100", "False", "Released"},
            new String[]{"2", "Bad", "2002-01-01", "not-a-number", "Drama", "100", "False", "Released"});
        Normalizer.NormalizationResult result = normalizer.normalizeAll(raw);

        assertEquals(1, result.records().size());
        assertEquals(1, result.rejections().size());
        Rejection rejection = result.rejections().get(0);
        assertEquals(RejectReason.MALFORMED_FIELD, rejection.reason());
        assertEquals(2, rejection.rowNumber());
        assertEquals("Bad", rejection.title());
    }

    @Test
    void testDateWithoutYearIsMalformed() {
        RawDataset raw = Records.raw(Dataset.METADATA, METADATA_HEADER,
            new String[]{"1", "Someday", "coming soon", "", "", "", "", ""});
        Normalizer.NormalizationResult result = normalizer.normalizeAll(raw);

        assertEquals(RejectReason.MALFORMED_FIELD, result.rejections().get(0).reason());
    }

    @Test
    void testMalformedDetailNamesSourceColumn() {
        RawDataset genres = Records.raw(Dataset.GENRES, List.of("movie_id", "movie_name", "year", "genre"),
            new String[]{"tt1", "Someday", "TBA", "Drama"});
        RawDataset financial = Records.raw(Dataset.FINANCIAL, List.of("Release Date", "Movie", "Production Budget"),
            new String[]{"Dec 18, 2009", "Avatar", "lots"});

        assertEquals("Cannot parse year value 'TBA'", normalizer.normalizeAll(genres).rejections().get(0).detail());
        assertEquals("Cannot parse Production Budget value 'lots'",
            normalizer.normalizeAll(financial).rejections().get(0).detail());
    }

    @Test
    void testOutOfRangeYearIsLeftForQualityFilter() {
        RawDataset raw = Records.raw(Dataset.METADATA, METADATA_HEADER,
            new String[]{"1", "Ancient", "1850", "", "", "", "", ""});
        assertEquals(1850, normalizer.normalizeAll(raw).records().get(0).year());
    }

    @Test
    void testMissingTitleColumnAborts() {
        RawDataset raw = Records.raw(Dataset.FINANCIAL, List.of("Release Date", "Production Budget"),
            new String[]{"Dec 18, 2009", "$1"});
        MissingColumnException e = assertThrows(MissingColumnException.class, () -> normalizer.normalizeAll(raw));
        assertEquals(Dataset.FINANCIAL, e.getDataset());
        assertEquals(ColumnRegistry.TITLE, e.getColumn());
    }

    @Test
    void testMissingDateColumnAborts() {
        RawDataset raw = Records.raw(Dataset.METADATA, List.of("id", "title"), new String[]{"1", "Heat"});
        MissingColumnException e = assertThrows(MissingColumnException.class, () -> normalizer.normalizeAll(raw));
        assertEquals(ColumnRegistry.RELEASE_DATE, e.getColumn());
    }
}
