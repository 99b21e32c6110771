package com.moviz.pipeline;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for parsing raw cell values shared by the normalization and quality stages.
 *
 * @author MoVIZ Pipeline Team
 * @since 1.0
 */
public class Utils {
    private static final Pattern RUNTIME = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(?:min|mins|minutes)?\\.?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER_NOISE = Pattern.compile("[$,\\s\\u00a0]");

    /**
     * Trims a raw value and maps blanks (and the literal "nan" pandas writes for missing cells) to null.
     * @param value raw value
     * @return trimmed value or null
     */
    public static String blankToNull(String value) {
        if (value == null) return null;
        String trimmed = value.strip();
        if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("nan")) return null;
        return trimmed;
    }

    public static boolean isBlank(String value) {
        return blankToNull(value) == null;
    }

    /**
     * Parses a whole number, tolerating currency symbols, thousands separators and a decimal part
     * (rounded half-up). "$160,000,000" and "160000000.0" both give 160000000.
     * @param value raw value
     * @param field field name for error reporting
     * @return parsed value, or null when blank
     * @throws MalformedFieldException if the value is not numeric
     */
    public static Long parseLong(String value, String field) throws MalformedFieldException {
        String cleaned = blankToNull(value);
        if (cleaned == null) return null;
        cleaned = NUMBER_NOISE.matcher(cleaned).replaceAll("");
        try {
            return new BigDecimal(cleaned).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MalformedFieldException(field, value);
        }
    }

    public static Double parseDouble(String value, String field) throws MalformedFieldException {
        String cleaned = blankToNull(value);
        if (cleaned == null) return null;
        try {
            return Double.parseDouble(NUMBER_NOISE.matcher(cleaned).replaceAll(""));
        } catch (NumberFormatException e) {
            throw new MalformedFieldException(field, value);
        }
    }

    /**
     * Parses a runtime in minutes, accepting a trailing unit ("142 min").
     */
    public static Integer parseRuntime(String value, String field) throws MalformedFieldException {
        String cleaned = blankToNull(value);
        if (cleaned == null) return null;
        Matcher m = RUNTIME.matcher(cleaned);
        if (!m.matches()) throw new MalformedFieldException(field, value);
        try {
            return new BigDecimal(m.group(1)).setScale(0, RoundingMode.HALF_UP).intValueExact();
        } catch (ArithmeticException e) {
            throw new MalformedFieldException(field, value);
        }
    }

    public static boolean parseFlag(String value) {
        String cleaned = blankToNull(value);
        if (cleaned == null) return false;
        String lower = cleaned.toLowerCase(Locale.ROOT);
        return lower.equals("true") || lower.equals("1") || lower.equals("yes");
    }

    /**
     * True when the value is blank or a number equal to zero. Non-numeric text counts as data.
     */
    public static boolean isZeroOrBlank(String value) {
        String cleaned = blankToNull(value);
        if (cleaned == null) return true;
        try {
            return new BigDecimal(NUMBER_NOISE.matcher(cleaned).replaceAll("")).signum() == 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
