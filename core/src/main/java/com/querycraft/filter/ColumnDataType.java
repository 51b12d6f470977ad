package com.querycraft.filter;

import com.querycraft.exception.ValidationException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static com.querycraft.filter.FilterOperator.*;

/**
 * Declared datatype of a filtered column.
 *
 * <p>The datatype decides which operators a condition may use and how its
 * value is compared (case-insensitive text matching, day-truncated dates,
 * plain numeric comparison).
 */
public enum ColumnDataType {

    NUMBER("number", EnumSet.of(
        EQ, NEQ, GT, GTE, LT, LTE, BETWEEN, IN, NOT_IN,
        CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH,
        IS_NULL, IS_NOT_NULL, IS_EMPTY, IS_NOT_EMPTY)),

    STRING("string", EnumSet.of(
        EQ, NEQ, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH, IN, NOT_IN,
        IS_NULL, IS_NOT_NULL, IS_EMPTY, IS_NOT_EMPTY)),

    DATE("date", EnumSet.of(
        EQ, NEQ, GT, GTE, LT, LTE, BETWEEN, IN, NOT_IN,
        CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH,
        IS_NULL, IS_NOT_NULL, IS_EMPTY, IS_NOT_EMPTY)),

    TIMESTAMP("timestamp", EnumSet.of(
        EQ, NEQ, GT, GTE, LT, LTE, BETWEEN, IN, NOT_IN,
        CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH,
        IS_NULL, IS_NOT_NULL, IS_EMPTY, IS_NOT_EMPTY));

    private final String token;
    private final Set<FilterOperator> allowedOperators;

    ColumnDataType(String token, Set<FilterOperator> allowedOperators) {
        this.token = token;
        this.allowedOperators = allowedOperators;
    }

    /**
     * Returns the wire token of this datatype (e.g. "timestamp").
     *
     * @return the token
     */
    public String token() {
        return token;
    }

    public boolean allows(FilterOperator operator) {
        return allowedOperators.contains(operator);
    }

    public boolean isTemporal() {
        return this == DATE || this == TIMESTAMP;
    }

    /**
     * Parses a datatype token (case-insensitive).
     *
     * @param value the token, or null for the default {@link #STRING}
     * @return the datatype
     * @throws ValidationException if the token is not recognized
     */
    public static ColumnDataType fromToken(String value) {
        if (value == null || value.isBlank()) {
            return STRING;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ColumnDataType type : values()) {
            if (type.token.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException(
            "Unknown datatype: '" + value + "'",
            "filter validation",
            value,
            "Use one of: number, string, date, timestamp");
    }

    @Override
    public String toString() {
        return token;
    }
}
