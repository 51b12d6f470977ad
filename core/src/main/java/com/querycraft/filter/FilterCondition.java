package com.querycraft.filter;

import com.querycraft.exception.ValidationException;

import java.util.Objects;

/**
 * A single filter condition targeting one column.
 *
 * <p>Examples:
 * <pre>
 *   FilterCondition.of("NAME", ColumnDataType.STRING, FilterOperator.CONTAINS, "Jo")
 *   FilterCondition.of("HIRED", ColumnDataType.DATE, FilterOperator.BETWEEN, List.of("2020-01-01", "2020-12-31"))
 *   FilterCondition.of("MANAGER_ID", ColumnDataType.NUMBER, FilterOperator.IS_NULL, null)
 * </pre>
 *
 * <p>The column may be qualified with a dataset ({@code "DEPT.NAME"}) to target a
 * joined dataset; unqualified columns belong to the base dataset.
 *
 * <p>The operator is checked against the datatype and the value shape is checked
 * against the operator when the condition is built.
 */
public final class FilterCondition implements FilterNode {

    private final String column;
    private final ColumnDataType dataType;
    private final FilterOperator operator;
    private final FilterValue value;

    /**
     * Creates a filter condition.
     *
     * @param column the column reference, optionally dataset-qualified
     * @param dataType the declared datatype
     * @param operator the operator
     * @param value the value operand
     * @throws ValidationException if the operator is not allowed for the datatype
     *         or the value shape does not fit the operator
     */
    public FilterCondition(String column, ColumnDataType dataType, FilterOperator operator, FilterValue value) {
        this.column = column == null ? "" : column;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");

        if (!dataType.allows(operator)) {
            throw new ValidationException(
                "Operator '" + operator + "' is not allowed for datatype '" + dataType + "'",
                "filter validation",
                toString(),
                "Pick an operator supported by " + dataType + " columns");
        }

        if (!fitsArity(operator, value)) {
            throw new ValidationException(
                "Operator '" + operator + "' does not accept value " + value,
                "filter validation",
                toString(),
                arityHint(operator));
        }
    }

    private static boolean fitsArity(FilterOperator operator, FilterValue value) {
        if (value instanceof FilterValue.Absent) {
            return true;
        }
        switch (operator.arity()) {
            case SCALAR:
                return value instanceof FilterValue.Scalar;
            case PAIR:
                return value instanceof FilterValue.Range;
            case LIST:
                return value instanceof FilterValue.ValueList;
            default:
                return false;
        }
    }

    private static String arityHint(FilterOperator operator) {
        switch (operator.arity()) {
            case PAIR:
                return "Provide [start, end]; leave one side empty for an open range";
            case LIST:
                return "Provide a list of values";
            case NONE:
                return "Operator '" + operator + "' takes no value";
            default:
                return "Provide a single value";
        }
    }

    /**
     * Creates a filter condition from a raw value.
     *
     * @param column the column reference
     * @param dataType the declared datatype
     * @param operator the operator
     * @param rawValue the raw value (null, scalar, or collection)
     * @return the condition
     * @throws ValidationException if the operator or value shape is invalid
     */
    public static FilterCondition of(String column, ColumnDataType dataType, FilterOperator operator, Object rawValue) {
        return new FilterCondition(column, dataType, operator, FilterValue.of(rawValue, operator));
    }

    public String column() {
        return column;
    }

    public ColumnDataType dataType() {
        return dataType;
    }

    public FilterOperator operator() {
        return operator;
    }

    public FilterValue value() {
        return value;
    }

    @Override
    public int leafCount() {
        return 1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FilterCondition that)) return false;
        return column.equals(that.column) &&
               dataType == that.dataType &&
               operator == that.operator &&
               value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, dataType, operator, value);
    }

    @Override
    public String toString() {
        return String.format("FilterCondition(%s %s %s, %s)", column, operator, value, dataType);
    }
}
