package com.moviz.pipeline;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Year extraction from heterogeneous date representations: full dates, bare years and year ranges.
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public final class YearExtractor {
    private YearExtractor() {}

    public static final int MIN_YEAR = 1880;
    public static final int MAX_YEAR = 2025;

    private static final Pattern YEAR_TOKEN = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");
    private static final Pattern ISO_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})[T ].*$");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("yyyy/M/d", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("d MMM yyyy", Locale.ENGLISH),
        DateTimeFormatter.ofPattern("d/M/yyyy", Locale.ENGLISH)
    );

    public static boolean isValidYear(int year) {
        return year >= MIN_YEAR && year <= MAX_YEAR;
    }

    /**
     * Extracts the first standalone 4-digit year token that lies inside [1880, 2025]. When tokens exist
     * but none is in range, the first token is returned as-is so the quality filter can reject it.
     *
     * @param value raw date-like value
     * @param field source column name, reported when the value is malformed
     * @return the year, or null when the value is blank
     * @throws MalformedFieldException when a non-blank value holds no 4-digit token
     */
    public static Integer extractYear(String value, String field) throws MalformedFieldException {
        if (value == null || value.isBlank()) return null;
        Matcher m = YEAR_TOKEN.matcher(value);
        Integer first = null;
        while (m.find()) {
            int year = Integer.parseInt(m.group(1));
            if (first == null) first = year;
            if (isValidYear(year)) return year;
        }
        if (first == null) {
            throw new MalformedFieldException(field, value);
        }
        return first;
    }

    /**
     * Parses a full calendar date when the value carries one. Year-only and range values yield empty.
     */
    public static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String candidate = value.trim();
        Matcher iso = ISO_PREFIX.matcher(candidate);
        if (iso.matches()) candidate = iso.group(1);
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(candidate, format));
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return Optional.empty();
    }
}
