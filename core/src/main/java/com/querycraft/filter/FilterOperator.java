package com.querycraft.filter;

import com.querycraft.exception.ValidationException;

import java.util.Locale;

/**
 * Operators a filter condition can apply to its column.
 */
public enum FilterOperator {

    // Text operators
    EQ("eq", Arity.SCALAR),
    NEQ("neq", Arity.SCALAR),
    CONTAINS("contains", Arity.SCALAR),
    NOT_CONTAINS("not_contains", Arity.SCALAR),
    STARTS_WITH("starts_with", Arity.SCALAR),
    ENDS_WITH("ends_with", Arity.SCALAR),

    // Numeric/date operators
    GT("gt", Arity.SCALAR),
    GTE("gte", Arity.SCALAR),
    LT("lt", Arity.SCALAR),
    LTE("lte", Arity.SCALAR),
    BETWEEN("between", Arity.PAIR),

    // Array operators
    IN("in", Arity.LIST),
    NOT_IN("not_in", Arity.LIST),

    // Null/empty operators
    IS_NULL("is_null", Arity.NONE),
    IS_NOT_NULL("is_not_null", Arity.NONE),
    IS_EMPTY("is_empty", Arity.NONE),
    IS_NOT_EMPTY("is_not_empty", Arity.NONE);

    /**
     * Shape of the value an operator takes.
     */
    public enum Arity {
        NONE,
        SCALAR,
        PAIR,
        LIST
    }

    private final String token;
    private final Arity arity;

    FilterOperator(String token, Arity arity) {
        this.token = token;
        this.arity = arity;
    }

    public String token() {
        return token;
    }

    public Arity arity() {
        return arity;
    }

    public boolean isUnary() {
        return arity == Arity.NONE;
    }

    public boolean isWildcard() {
        return this == CONTAINS || this == NOT_CONTAINS || this == STARTS_WITH || this == ENDS_WITH;
    }

    /**
     * Returns the SQL symbol for a plain comparison operator.
     *
     * @return the symbol (e.g. "&gt;="), or null if this is not a plain comparison
     */
    public String comparisonSymbol() {
        switch (this) {
            case EQ:
                return "=";
            case NEQ:
                return "!=";
            case GT:
                return ">";
            case GTE:
                return ">=";
            case LT:
                return "<";
            case LTE:
                return "<=";
            default:
                return null;
        }
    }

    /**
     * Parses an operator token (case-insensitive).
     *
     * @param value the token, e.g. "not_in"
     * @return the operator
     * @throws ValidationException if the token is not recognized
     */
    public static FilterOperator fromToken(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (FilterOperator op : values()) {
                if (op.token.equals(normalized)) {
                    return op;
                }
            }
        }
        throw new ValidationException(
            "Unsupported operator: '" + value + "'",
            "filter validation",
            String.valueOf(value),
            "Use one of the documented filter operators, e.g. eq, contains, between, in");
    }

    @Override
    public String toString() {
        return token;
    }
}
