package com.querycraft.request;

import com.querycraft.exception.ValidationException;

import java.util.Locale;
import java.util.Objects;

/**
 * Sort order for one output column.
 *
 * @param column the column or aggregation alias to sort by
 * @param direction the sort direction
 */
public record SortSpec(String column, Direction direction) {

    public SortSpec {
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
    }

    public static SortSpec asc(String column) {
        return new SortSpec(column, Direction.ASC);
    }

    public static SortSpec desc(String column) {
        return new SortSpec(column, Direction.DESC);
    }

    /**
     * Sort directions.
     */
    public enum Direction {
        ASC,
        DESC;

        /**
         * Parses a direction token (case-insensitive), defaulting to ASC.
         *
         * @param value the token
         * @return the direction
         * @throws ValidationException if the token is not ASC or DESC
         */
        public static Direction fromToken(String value) {
            if (value == null || value.isBlank()) {
                return ASC;
            }
            switch (value.trim().toUpperCase(Locale.ROOT)) {
                case "ASC":
                    return ASC;
                case "DESC":
                    return DESC;
                default:
                    throw new ValidationException(
                        "Unknown sort direction: '" + value + "'",
                        "sort validation",
                        value,
                        "Use ASC or DESC");
            }
        }
    }
}
