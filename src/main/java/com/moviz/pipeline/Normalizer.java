package com.moviz.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.*;

import static com.moviz.pipeline.ColumnRegistry.*;

/**
 * Per-dataset field-level transforms that turn {@link RawRecord}s into {@link NormalizedRecord}s.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Resolves the dataset header against {@link ColumnRegistry} once, unifying column names. A header
 *       without a title or date-like column aborts the run with {@link MissingColumnException}.</li>
 *   <li>Normalizes the title with {@link TitleNormalizer} and extracts the year with {@link YearExtractor}.</li>
 *   <li>Remaps certificates and genre labels through the lookup tables.</li>
 *   <li>Parses numeric payload; any unparseable non-blank value rejects the record as
 *       {@link RejectReason#MALFORMED_FIELD}.</li>
 * </ul>
 * Year range is not checked here; out-of-range years are rejected by {@link QualityFilter}.
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public class Normalizer {
    private static final Logger logger = LoggerFactory.getLogger(Normalizer.class);

    private final CertificateMapper certificateMapper;
    private final GenreMapper genreMapper;

    public Normalizer(CertificateMapper certificateMapper, GenreMapper genreMapper) {
        this.certificateMapper = certificateMapper;
        this.genreMapper = genreMapper;
    }

    /**
     * Result of normalizing one dataset.
     */
    public record NormalizationResult(Dataset dataset, List<NormalizedRecord> records, List<Rejection> rejections) {
        public NormalizationResult {
            records = List.copyOf(records);
            rejections = List.copyOf(rejections);
        }
    }

    /**
     * Normalizes every row of a dataset, in input order.
     * @param raw loaded dataset
     * @return normalized records plus MALFORMED_FIELD rejections
     * @throws MissingColumnException if the header lacks a required column
     */
    public NormalizationResult normalizeAll(RawDataset raw) {
        Map<String, String> mapping = resolveHeader(raw);
        List<NormalizedRecord> records = new ArrayList<>();
        List<Rejection> rejections = new ArrayList<>();
        for (RawRecord row : raw.rows()) {
            RecordOutcome outcome = normalize(row, mapping);
            if (outcome.isAccepted()) {
                records.add(outcome.record());
            } else {
                rejections.add(outcome.rejection());
            }
        }
        logger.info("Normalized {} rows of '{}': {} accepted, {} malformed", raw.rows().size(),
            raw.dataset().sourceName(), records.size(), rejections.size());
        return new NormalizationResult(raw.dataset(), records, rejections);
    }

    /**
     * Resolves and logs the column unification for a dataset header.
     */
    public Map<String, String> resolveHeader(RawDataset raw) {
        Map<String, String> mapping = ColumnRegistry.resolveHeader(raw.dataset(), raw.header());
        logger.debug("Column mapping for '{}': {}", raw.dataset().sourceName(), mapping);
        return mapping;
    }

    /**
     * Normalizes one raw record.
     * @param raw     the row
     * @param mapping canonical column name to source column name, from {@link ColumnRegistry#resolveHeader}
     * @return the normalized record, or a MALFORMED_FIELD rejection
     */
    public RecordOutcome normalize(RawRecord raw, Map<String, String> mapping) {
        Map<String, String> columns = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            columns.put(entry.getKey(), Utils.blankToNull(raw.get(entry.getValue())));
        }
        String title = columns.get(TITLE);
        try {
            String dateValue = columns.get(RELEASE_DATE);
            Integer year = YearExtractor.extractYear(dateValue, sourceColumn(mapping, RELEASE_DATE));
            LocalDate releaseDate = YearExtractor.parseDate(dateValue).orElse(null);
            Certificate certificate = columns.containsKey(CERTIFICATE) ? certificateMapper.map(columns.get(CERTIFICATE)) : null;
            NormalizedRecord record = new NormalizedRecord(
                raw.dataset(),
                raw.rowNumber(),
                columns.get(RAW_ID),
                title,
                TitleNormalizer.normalize(title),
                year,
                null,
                releaseDate,
                Utils.parseDouble(columns.get(RATING), sourceColumn(mapping, RATING)),
                Utils.parseLong(columns.get(VOTES), sourceColumn(mapping, VOTES)),
                Utils.parseRuntime(columns.get(RUNTIME), sourceColumn(mapping, RUNTIME)),
                Utils.parseDouble(columns.get(POPULARITY), sourceColumn(mapping, POPULARITY)),
                certificate,
                genreMapper.mapLabels(columns.get(GENRE)),
                Utils.parseLong(columns.get(PRODUCTION_BUDGET), sourceColumn(mapping, PRODUCTION_BUDGET)),
                Utils.parseLong(columns.get(DOMESTIC_GROSS), sourceColumn(mapping, DOMESTIC_GROSS)),
                Utils.parseLong(columns.get(WORLDWIDE_GROSS), sourceColumn(mapping, WORLDWIDE_GROSS)),
                Utils.parseFlag(columns.get(ADULT)),
                columns.get(STATUS),
                columns.get(DESCRIPTION),
                columns
            );
            return RecordOutcome.accepted(record);
        } catch (MalformedFieldException e) {
            logger.debug("Rejected '{}' row {} ({}): {}", raw.dataset().sourceName(), raw.rowNumber(), title, e.getMessage());
            return RecordOutcome.rejected(new Rejection(raw.dataset(), raw.rowNumber(), title, RejectReason.MALFORMED_FIELD, e.getMessage()));
        }
    }

    private static String sourceColumn(Map<String, String> mapping, String canonical) {
        return mapping.getOrDefault(canonical, canonical);
    }
}
