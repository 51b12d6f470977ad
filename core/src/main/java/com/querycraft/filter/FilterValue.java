package com.querycraft.filter;

import com.querycraft.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The value operand of a filter condition.
 *
 * <p>A condition's value is one of four shapes, chosen by the operator's
 * {@link FilterOperator.Arity} and validated once when the condition is built:
 * <ul>
 *   <li>{@link Absent} - unary operators (is_null, is_empty, ...) or a value not yet typed</li>
 *   <li>{@link Scalar} - comparisons and text matching</li>
 *   <li>{@link Range} - between, with either side possibly blank</li>
 *   <li>{@link ValueList} - in / not_in</li>
 * </ul>
 */
public sealed interface FilterValue
    permits FilterValue.Absent, FilterValue.Scalar, FilterValue.Range, FilterValue.ValueList {

    Pattern LIST_SEPARATOR = Pattern.compile("[,\\t\\n\\r]+");

    /**
     * Returns whether a value was supplied. Blank strings count as not supplied.
     *
     * @return true if there is something to compare against
     */
    boolean isPresent();

    /**
     * No value.
     */
    final class Absent implements FilterValue {

        static final Absent INSTANCE = new Absent();

        private Absent() {}

        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public String toString() {
            return "<absent>";
        }
    }

    /**
     * A single value.
     */
    record Scalar(Object value) implements FilterValue {

        public Scalar {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean isPresent() {
            return !isBlank(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * A between pair. Either bound may be null or blank.
     */
    record Range(Object start, Object end) implements FilterValue {

        public boolean hasStart() {
            return !isBlank(start);
        }

        public boolean hasEnd() {
            return !isBlank(end);
        }

        @Override
        public boolean isPresent() {
            return hasStart() || hasEnd();
        }

        @Override
        public String toString() {
            return "[" + start + ", " + end + "]";
        }
    }

    /**
     * An in-list. Null and blank elements are dropped on construction.
     */
    record ValueList(List<Object> values) implements FilterValue {

        public ValueList {
            List<Object> kept = new ArrayList<>();
            for (Object v : Objects.requireNonNull(values, "values must not be null")) {
                if (!isBlank(v)) {
                    kept.add(v);
                }
            }
            values = Collections.unmodifiableList(kept);
        }

        @Override
        public boolean isPresent() {
            return !values.isEmpty();
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }

    static FilterValue absent() {
        return Absent.INSTANCE;
    }

    /**
     * Builds the value for an operator from a raw payload value.
     *
     * <p>Strings given to in/not_in are split on commas, tabs and line breaks.
     * A between value must be a two-element list. A null or blank value for a
     * binary operator is {@link Absent}; an explicit empty list stays a list.
     *
     * @param raw the raw value (null, a scalar, or a collection)
     * @param operator the operator the value belongs to
     * @return the typed value
     * @throws ValidationException if the shape does not fit the operator
     */
    static FilterValue of(Object raw, FilterOperator operator) {
        Objects.requireNonNull(operator, "operator must not be null");

        switch (operator.arity()) {
            case NONE:
                return absent();

            case SCALAR:
                if (raw == null) {
                    return absent();
                }
                if (raw instanceof Collection) {
                    throw new ValidationException(
                        "Operator '" + operator + "' expects a single value",
                        "filter validation",
                        String.valueOf(raw),
                        "Use 'in' to match against several values");
                }
                return new Scalar(raw);

            case PAIR:
                if (isBlank(raw)) {
                    return absent();
                }
                if (!(raw instanceof Collection<?> bounds) || bounds.size() != 2) {
                    throw new ValidationException(
                        "Value must be a list of exactly 2 items for operator '" + operator + "'",
                        "filter validation",
                        String.valueOf(raw),
                        "Provide [start, end]; leave one side empty for an open range");
                }
                List<?> pair = new ArrayList<>(bounds);
                return new Range(pair.get(0), pair.get(1));

            case LIST:
                if (isBlank(raw)) {
                    return absent();
                }
                if (raw instanceof Collection<?> collection) {
                    return new ValueList(new ArrayList<>(collection));
                }
                if (raw instanceof String text) {
                    List<Object> items = new ArrayList<>();
                    for (String item : LIST_SEPARATOR.split(text)) {
                        items.add(item.trim());
                    }
                    return new ValueList(items);
                }
                return new ValueList(List.of(raw));

            default:
                throw new IllegalStateException("Unhandled arity: " + operator.arity());
        }
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String text && text.trim().isEmpty());
    }
}
