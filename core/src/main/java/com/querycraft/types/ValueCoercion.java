package com.querycraft.types;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Conversions applied to filter and partition values before they are bound.
 *
 * <p>Values that cannot be converted are returned unchanged; the database
 * reports the mismatch when the statement runs.
 */
public final class ValueCoercion {

    private static final Pattern OFFSET_SUFFIX = Pattern.compile(".*(Z|[+-]\\d{2}:?\\d{2})$");

    private ValueCoercion() {
    }

    /**
     * Parses an ISO-8601 date or date-time string.
     *
     * <p>A ten-character string ({@code 2024-01-31}) becomes a {@link LocalDate};
     * a date-time with a zone offset or {@code Z} becomes an {@link OffsetDateTime};
     * any other date-time (with {@code T} or a space separator) becomes a
     * {@link LocalDateTime}.
     *
     * @param value the raw value
     * @return the parsed value, or the input if it is not a parseable string
     */
    public static Object parseTemporal(Object value) {
        if (!(value instanceof String raw)) {
            return value;
        }
        String text = raw.trim();
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text);
            }
            String iso = text.replace(' ', 'T');
            if (OFFSET_SUFFIX.matcher(iso).matches()) {
                return OffsetDateTime.parse(iso);
            }
            return LocalDateTime.parse(iso);
        } catch (DateTimeParseException e) {
            return value;
        }
    }

    /**
     * Coerces a partition value according to the partition column's base type.
     *
     * @param value the raw value
     * @param baseType the lower-cased base type ("date", "timestamp", "number",
     *                 "integer"), or an empty string if unknown
     * @return the coerced value
     */
    public static Object coercePartitionValue(Object value, String baseType) {
        switch (baseType.toLowerCase(Locale.ROOT)) {
            case "date":
            case "timestamp":
                return parseTemporal(value);
            case "number":
            case "integer":
                return parseNumber(value);
            default:
                return value;
        }
    }

    /**
     * Parses a numeric string into a {@link Long} or {@link BigDecimal}.
     *
     * @param value the raw value
     * @return the number, or the input if it is not a numeric string
     */
    public static Object parseNumber(Object value) {
        if (!(value instanceof String raw)) {
            return value;
        }
        String text = raw.trim();
        try {
            if (text.indexOf('.') < 0) {
                return Long.parseLong(text);
            }
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return value;
        }
    }

    /**
     * Drops trailing fractional zeros so "1.50" matches the database's "1.5".
     *
     * @param text the numeric text
     * @return the trimmed text
     */
    public static String trimTrailingZeros(String text) {
        if (text.indexOf('.') < 0) {
            return text;
        }
        String trimmed = text;
        while (trimmed.endsWith("0")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
