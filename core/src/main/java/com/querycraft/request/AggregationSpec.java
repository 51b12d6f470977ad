package com.querycraft.request;

import com.querycraft.exception.ValidationException;

import java.util.Locale;
import java.util.Objects;

/**
 * One aggregation to compute, e.g. "sum of SALES as Total Sales".
 *
 * <p>The output alias is free text supplied by the user; it is sanitized and
 * de-duplicated at compile time.
 *
 * @param sourceColumn the column to aggregate, optionally dataset-qualified
 * @param function the aggregate function
 * @param outputAlias the requested output name (may be blank)
 */
public record AggregationSpec(String sourceColumn, Function function, String outputAlias) {

    public AggregationSpec {
        Objects.requireNonNull(sourceColumn, "sourceColumn must not be null");
        Objects.requireNonNull(function, "function must not be null");
    }

    /**
     * Returns the alias requested by the user, or {@code FUNCTION_column} when blank.
     *
     * @return the unsanitized output name
     */
    public String requestedAlias() {
        if (outputAlias != null && !outputAlias.trim().isEmpty()) {
            return outputAlias.trim();
        }
        return function.name() + "_" + sourceColumn;
    }

    /**
     * Supported aggregate functions.
     */
    public enum Function {
        SUM("sum"),
        AVG("avg"),
        COUNT("count"),
        MIN("min"),
        MAX("max"),
        DISTINCT_COUNT("distinct_count");

        private final String token;

        Function(String token) {
            this.token = token;
        }

        public String token() {
            return token;
        }

        /**
         * Renders this function applied to an already-quoted column.
         *
         * @param columnSql the column SQL
         * @return e.g. {@code SUM("T"."AMOUNT")} or {@code COUNT(DISTINCT "T"."ID")}
         */
        public String apply(String columnSql) {
            if (this == DISTINCT_COUNT) {
                return "COUNT(DISTINCT " + columnSql + ")";
            }
            return name() + "(" + columnSql + ")";
        }

        /**
         * Parses a function token (case-insensitive).
         *
         * @param value the token
         * @return the function
         * @throws ValidationException if the token is not recognized
         */
        public static Function fromToken(String value) {
            if (value != null) {
                String normalized = value.trim().toLowerCase(Locale.ROOT);
                for (Function f : values()) {
                    if (f.token.equals(normalized)) {
                        return f;
                    }
                }
            }
            throw new ValidationException(
                "Unknown aggregation function: '" + value + "'",
                "aggregation validation",
                String.valueOf(value),
                "Use one of: sum, avg, count, min, max, distinct_count");
        }
    }
}
