package com.querycraft.generator;

import com.querycraft.config.CompilerSettings;
import com.querycraft.exception.SQLGenerationException;
import com.querycraft.filter.FilterCondition;
import com.querycraft.filter.FilterOperator;
import com.querycraft.filter.FilterValue;
import com.querycraft.types.ResolvedColumnType;
import com.querycraft.types.ValueCoercion;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Compiles a single filter condition into a SQL predicate.
 *
 * <p>Every value is bound through the {@link ParamGenerator}; the returned SQL
 * only ever contains the quoted column, fixed SQL text and placeholders.
 *
 * <p>Text matching is case-insensitive: both the column and the bound value
 * are upper-cased. Date comparisons truncate the column to the day. Numbers
 * and dates can also be matched with contains/starts_with/ends_with against
 * their text rendering.
 *
 * <p>Conditions a user is still editing degrade to neutral predicates instead
 * of failing: a missing value compiles to {@code 1=1}, an empty in-list to
 * {@code 1=0} (or {@code 1=1} for not_in), and a one-sided between to a
 * single comparison.
 */
public class ConditionCompiler {

    static final String ALWAYS_TRUE = "1=1";
    static final String ALWAYS_FALSE = "1=0";

    private static final String DATE_TEXT_FORMAT = "'YYYY-MM-DD HH24:MI:SS'";
    private static final String NUMBER_TEXT_FORMAT = "'TM', 'NLS_NUMERIC_CHARACTERS=''. '''";

    private final CompilerSettings settings;

    public ConditionCompiler(CompilerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Compiles a condition against an already-quoted column expression.
     *
     * @param condition the condition
     * @param columnSql the quoted column (or aggregate) expression; blank if the
     *                  column reference could not be resolved
     * @param type the resolved column type
     * @param params the parameter generator of this compilation
     * @return the predicate, without surrounding parentheses
     * @throws SQLGenerationException if the operator cannot be applied to the resolved type
     */
    public String compile(FilterCondition condition, String columnSql, ResolvedColumnType type,
                          ParamGenerator params) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(params, "params must not be null");

        if (columnSql == null || columnSql.isBlank()) {
            return ALWAYS_TRUE;
        }

        FilterOperator op = condition.operator();
        if (!type.dataType().allows(op)) {
            throw new SQLGenerationException(
                "Operator '" + op + "' cannot be applied to a " + type.dataType() + " column", condition);
        }

        switch (op) {
            case IS_NULL:
                return columnSql + " IS NULL";
            case IS_NOT_NULL:
                return columnSql + " IS NOT NULL";
            case IS_EMPTY:
                return type.text()
                    ? "(" + columnSql + " IS NULL OR " + columnSql + " = '')"
                    : columnSql + " IS NULL";
            case IS_NOT_EMPTY:
                return type.text()
                    ? "(" + columnSql + " IS NOT NULL AND " + columnSql + " != '')"
                    : columnSql + " IS NOT NULL";
            default:
                break;
        }

        FilterValue value = condition.value();
        if (value instanceof FilterValue.ValueList list) {
            return compileInList(condition, columnSql, type, list, params);
        }
        if (!value.isPresent()) {
            return ALWAYS_TRUE;
        }

        if (op.isWildcard()) {
            return compileWildcard(op, columnSql, type, scalar(condition), params);
        }
        if (op == FilterOperator.BETWEEN) {
            return compileBetween(condition, columnSql, type, params);
        }

        String symbol = op.comparisonSymbol();
        if (symbol == null) {
            throw new SQLGenerationException("Unsupported operator: " + op, condition);
        }
        Object operand = scalar(condition);

        if (type.isTemporal()) {
            String placeholder = params.add(ValueCoercion.parseTemporal(operand));
            return "TRUNC(" + columnSql + ") " + symbol + " " + placeholder;
        }
        if (type.text() && (op == FilterOperator.EQ || op == FilterOperator.NEQ)) {
            String placeholder = params.add(upper(operand));
            return "UPPER(" + castToText(columnSql) + ") " + symbol + " UPPER(" + placeholder + ")";
        }
        return columnSql + " " + symbol + " " + params.add(operand);
    }

    private String compileWildcard(FilterOperator op, String columnSql, ResolvedColumnType type,
                                   Object operand, ParamGenerator params) {
        String text = String.valueOf(operand);
        if (type.isNumeric() && !type.text()) {
            text = ValueCoercion.trimTrailingZeros(text);
        }
        String pattern;
        switch (op) {
            case STARTS_WITH:
                pattern = text + "%";
                break;
            case ENDS_WITH:
                pattern = "%" + text;
                break;
            default:
                pattern = "%" + text + "%";
                break;
        }
        String placeholder = params.add(pattern.toUpperCase(Locale.ROOT));
        String like = op == FilterOperator.NOT_CONTAINS ? "NOT LIKE" : "LIKE";
        return "UPPER(" + asText(columnSql, type) + ") " + like + " UPPER(" + placeholder + ")";
    }

    private String compileInList(FilterCondition condition, String columnSql, ResolvedColumnType type,
                                 FilterValue.ValueList list, ParamGenerator params) {
        boolean negated = condition.operator() == FilterOperator.NOT_IN;
        List<Object> values = list.values();
        if (values.isEmpty()) {
            return negated ? ALWAYS_TRUE : ALWAYS_FALSE;
        }
        if (values.size() > settings.maxInListSize()) {
            values = values.subList(0, settings.maxInListSize());
        }

        List<String> placeholders = new ArrayList<>(values.size());
        for (Object item : values) {
            Object bound = item;
            if (type.isTemporal()) {
                bound = ValueCoercion.parseTemporal(item);
            } else if (type.text() && item instanceof String text) {
                bound = text.toUpperCase(Locale.ROOT);
            }
            placeholders.add(params.add(bound));
        }

        String target = type.text() && !type.isTemporal()
            ? "UPPER(" + castToText(columnSql) + ")"
            : columnSql;
        return target + (negated ? " NOT IN (" : " IN (") + String.join(", ", placeholders) + ")";
    }

    private String compileBetween(FilterCondition condition, String columnSql, ResolvedColumnType type,
                                  ParamGenerator params) {
        if (!(condition.value() instanceof FilterValue.Range range)) {
            throw new SQLGenerationException("Value must be 2 items for 'between'", condition);
        }
        String target = type.isTemporal() ? "TRUNC(" + columnSql + ")" : columnSql;

        if (range.hasStart() && range.hasEnd()) {
            String start = params.add(coerce(range.start(), type));
            String end = params.add(coerce(range.end(), type));
            return target + " BETWEEN " + start + " AND " + end;
        }
        if (range.hasStart()) {
            return target + " >= " + params.add(coerce(range.start(), type));
        }
        if (range.hasEnd()) {
            return target + " <= " + params.add(coerce(range.end(), type));
        }
        return ALWAYS_TRUE;
    }

    private static Object scalar(FilterCondition condition) {
        if (!(condition.value() instanceof FilterValue.Scalar scalar)) {
            throw new SQLGenerationException(
                "Operator '" + condition.operator() + "' expects a single value", condition);
        }
        return scalar.value();
    }

    private static Object coerce(Object value, ResolvedColumnType type) {
        return type.isTemporal() ? ValueCoercion.parseTemporal(value) : value;
    }

    private static String upper(Object value) {
        return String.valueOf(value).toUpperCase(Locale.ROOT);
    }

    private static String asText(String columnSql, ResolvedColumnType type) {
        if (type.isTemporal()) {
            return "TO_CHAR(" + columnSql + ", " + DATE_TEXT_FORMAT + ")";
        }
        if (type.isNumeric() && !type.text()) {
            return "TO_CHAR(" + columnSql + ", " + NUMBER_TEXT_FORMAT + ")";
        }
        return castToText(columnSql);
    }

    private static String castToText(String columnSql) {
        return "CAST(" + columnSql + " AS VARCHAR2(4000))";
    }
}
