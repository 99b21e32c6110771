package com.moviz.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.function.Function;

/**
 * Row-level admission control for one dataset.
 * <p>
 * Every rule is an independent predicate; a record is accepted when no rule fires. The reported reason
 * is the first violated rule in declaration order:
 * <ol>
 *   <li>{@link RejectReason#CRITICAL_NULL}: a critical column of {@link ColumnRegistry} is blank. A genre
 *       record carrying a native id is exempt; it can only join on that id.</li>
 *   <li>{@link RejectReason#YEAR_OUT_OF_RANGE}: year outside [1880, 2025].</li>
 *   <li>{@link RejectReason#EXCLUDED_CONTENT}: metadata only, adult, or status other than
 *       {@code Released} (a blank status included) when the dataset has a status column.</li>
 *   <li>{@link RejectReason#NO_PRODUCTION_DATA}: metadata only, runtime, budget and revenue all zero or blank.</li>
 *   <li>{@link RejectReason#FUTURE_RELEASE}: financial only, release date after today.</li>
 *   <li>{@link RejectReason#NON_CRITICAL_THRESHOLD_EXCEEDED}: more than 80% of the non-critical columns
 *       present in the dataset are blank.</li>
 * </ol>
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public class QualityFilter {
    private static final Logger logger = LoggerFactory.getLogger(QualityFilter.class);

    public static final double DEFAULT_MISSING_THRESHOLD = 0.8;
    private static final String RELEASED = "Released";

    private final Clock clock;
    private final double missingThreshold;
    private final List<Rule> rules;

    private record Rule(RejectReason reason, Function<NormalizedRecord, String> violation) {}

    /**
     * Result of filtering one dataset.
     */
    public record FilterResult(List<NormalizedRecord> accepted, List<Rejection> rejections) {
        public FilterResult {
            accepted = List.copyOf(accepted);
            rejections = List.copyOf(rejections);
        }
    }

    public QualityFilter() {
        this(Clock.systemDefaultZone(), DEFAULT_MISSING_THRESHOLD);
    }

    public QualityFilter(Clock clock, double missingThreshold) {
        this.clock = clock;
        this.missingThreshold = missingThreshold;
        this.rules = List.of(
            new Rule(RejectReason.CRITICAL_NULL, this::criticalNull),
            new Rule(RejectReason.YEAR_OUT_OF_RANGE, this::yearOutOfRange),
            new Rule(RejectReason.EXCLUDED_CONTENT, this::excludedContent),
            new Rule(RejectReason.NO_PRODUCTION_DATA, this::noProductionData),
            new Rule(RejectReason.FUTURE_RELEASE, this::futureRelease),
            new Rule(RejectReason.NON_CRITICAL_THRESHOLD_EXCEEDED, this::tooManyMissing)
        );
    }

    /**
     * Filters a dataset, keeping input order.
     * @param records normalized records of a single dataset
     * @return accepted records and tagged rejections
     */
    public FilterResult filter(List<NormalizedRecord> records) {
        List<NormalizedRecord> accepted = new ArrayList<>();
        List<Rejection> rejections = new ArrayList<>();
        for (NormalizedRecord record : records) {
            Optional<Rejection> rejection = check(record);
            if (rejection.isPresent()) {
                rejections.add(rejection.get());
                logger.debug("Rejected '{}' row {} ({}): {}", record.dataset().sourceName(), record.rowNumber(),
                    record.title(), rejection.get().detail());
            } else {
                accepted.add(record);
            }
        }
        if (!records.isEmpty()) {
            logger.info("Quality filter on '{}': {} accepted, {} rejected", records.get(0).dataset().sourceName(),
                accepted.size(), rejections.size());
        }
        return new FilterResult(accepted, rejections);
    }

    /**
     * Applies every rule to one record.
     * @return the first violated rule as a rejection, or empty if the record passes
     */
    public Optional<Rejection> check(NormalizedRecord record) {
        for (Rule rule : rules) {
            String detail = rule.violation().apply(record);
            if (detail != null) {
                return Optional.of(new Rejection(record.dataset(), record.rowNumber(), record.title(), rule.reason(), detail));
            }
        }
        return Optional.empty();
    }

    private String criticalNull(NormalizedRecord record) {
        if (record.dataset() == Dataset.GENRES && record.hasRawId()) return null;
        for (ColumnField field : ColumnRegistry.getFields(record.dataset())) {
            if (field.isCritical() && Utils.isBlank(record.columns().get(field.fieldName))) {
                return "Critical column '" + field.fieldName + "' is empty";
            }
        }
        if (record.normalizedTitle() == null || record.normalizedTitle().isEmpty()) {
            return "Title normalizes to an empty string";
        }
        if (record.year() == null) {
            return "No year could be extracted";
        }
        return null;
    }

    private String yearOutOfRange(NormalizedRecord record) {
        if (record.year() != null && !YearExtractor.isValidYear(record.year())) {
            return "Year " + record.year() + " outside [" + YearExtractor.MIN_YEAR + ", " + YearExtractor.MAX_YEAR + "]";
        }
        return null;
    }

    private String excludedContent(NormalizedRecord record) {
        if (record.dataset() != Dataset.METADATA) return null;
        if (record.adult()) return "Adult content";
        if (!record.columns().containsKey(ColumnRegistry.STATUS)) return null;
        if (record.status() == null) return "Status is empty, not released";
        if (!record.status().equalsIgnoreCase(RELEASED)) {
            return "Status is '" + record.status() + "', not released";
        }
        return null;
    }

    private String noProductionData(NormalizedRecord record) {
        if (record.dataset() != Dataset.METADATA) return null;
        Map<String, String> columns = record.columns();
        List<String> checked = List.of(ColumnRegistry.RUNTIME, ColumnRegistry.BUDGET, ColumnRegistry.REVENUE);
        for (String column : checked) {
            if (!columns.containsKey(column) || !Utils.isZeroOrBlank(columns.get(column))) return null;
        }
        return "Runtime, budget and revenue are all zero or empty";
    }

    private String futureRelease(NormalizedRecord record) {
        if (record.dataset() != Dataset.FINANCIAL || record.releaseDate() == null) return null;
        LocalDate today = LocalDate.now(clock);
        if (record.releaseDate().isAfter(today)) {
            return "Release date " + record.releaseDate() + " is in the future";
        }
        return null;
    }

    private String tooManyMissing(NormalizedRecord record) {
        int present = 0;
        int missing = 0;
        for (ColumnField field : ColumnRegistry.getFields(record.dataset())) {
            if (!field.isNonCritical() || !record.columns().containsKey(field.fieldName)) continue;
            present++;
            if (Utils.isBlank(record.columns().get(field.fieldName))) missing++;
        }
        if (present == 0) return null;
        double fraction = (double) missing / present;
        if (fraction > missingThreshold) {
            return String.format(Locale.ROOT, "%d of %d non-critical columns empty (%.0f%% > %.0f%%)",
                missing, present, fraction * 100, missingThreshold * 100);
        }
        return null;
    }
}
