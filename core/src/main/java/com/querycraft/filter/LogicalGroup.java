package com.querycraft.filter;

import com.querycraft.exception.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A nested AND/OR group of filter nodes.
 *
 * <p>Examples:
 * <pre>
 *   LogicalGroup.and(statusIsActive, LogicalGroup.or(ageOver18, isManager))
 * </pre>
 *
 * <p>An empty group is neutral: it compiles to an always-true predicate.
 */
public final class LogicalGroup implements FilterNode {

    /**
     * Boolean connective joining a group's children.
     */
    public enum Logic {
        AND,
        OR;

        /**
         * Parses a logic token (case-insensitive), defaulting to AND.
         *
         * @param value the token
         * @return the logic
         * @throws ValidationException if the token is not AND or OR
         */
        public static Logic fromToken(String value) {
            if (value == null || value.isBlank()) {
                return AND;
            }
            switch (value.trim().toUpperCase(Locale.ROOT)) {
                case "AND":
                    return AND;
                case "OR":
                    return OR;
                default:
                    throw new ValidationException(
                        "Unknown group logic: '" + value + "'",
                        "filter validation",
                        value,
                        "Use AND or OR");
            }
        }

        /**
         * Returns the connective with surrounding spaces, ready for joining fragments.
         *
         * @return " AND " or " OR "
         */
        public String separator() {
            return " " + name() + " ";
        }
    }

    private final Logic logic;
    private final List<FilterNode> children;

    /**
     * Creates a logical group.
     *
     * @param logic the connective
     * @param children the child nodes, in order
     */
    public LogicalGroup(Logic logic, List<? extends FilterNode> children) {
        this.logic = Objects.requireNonNull(logic, "logic must not be null");
        Objects.requireNonNull(children, "children must not be null");
        List<FilterNode> copy = new ArrayList<>(children.size());
        for (FilterNode child : children) {
            copy.add(Objects.requireNonNull(child, "child must not be null"));
        }
        this.children = Collections.unmodifiableList(copy);
    }

    public static LogicalGroup and(FilterNode... children) {
        return new LogicalGroup(Logic.AND, Arrays.asList(children));
    }

    public static LogicalGroup or(FilterNode... children) {
        return new LogicalGroup(Logic.OR, Arrays.asList(children));
    }

    public Logic logic() {
        return logic;
    }

    /**
     * Returns the child nodes.
     *
     * @return an unmodifiable list of children
     */
    public List<FilterNode> children() {
        return children;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public int leafCount() {
        int count = 0;
        for (FilterNode child : children) {
            count += child.leafCount();
        }
        return count;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LogicalGroup that)) return false;
        return logic == that.logic && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logic, children);
    }

    @Override
    public String toString() {
        return logic + children.toString();
    }
}
