package com.querycraft.request;

import com.querycraft.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A join between two datasets on one or more column pairs.
 *
 * <p>Datasets are named by their logical identifiers; unique aliases are assigned
 * later by the join planner, so a dataset may be joined to itself.
 *
 * <p>Supported join types:
 * <ul>
 *   <li>INNER - Standard inner join</li>
 *   <li>LEFT - Left outer join</li>
 *   <li>RIGHT - Right outer join</li>
 *   <li>OUTER - Full outer join</li>
 * </ul>
 */
public final class JoinSpec {

    private final String leftDataset;
    private final String rightDataset;
    private final JoinType joinType;
    private final List<JoinKey> keys;

    /**
     * Creates a join spec.
     *
     * @param leftDataset the dataset to join from (the base or a previously joined dataset)
     * @param rightDataset the dataset to join to
     * @param joinType the join type
     * @param keys the column pairs to join on
     * @throws ValidationException if no key pairs are given
     */
    public JoinSpec(String leftDataset, String rightDataset, JoinType joinType, List<JoinKey> keys) {
        this.leftDataset = Objects.requireNonNull(leftDataset, "leftDataset must not be null");
        this.rightDataset = Objects.requireNonNull(rightDataset, "rightDataset must not be null");
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        Objects.requireNonNull(keys, "keys must not be null");
        if (keys.isEmpty()) {
            throw new ValidationException(
                "Join from '" + leftDataset + "' to '" + rightDataset + "' has no join columns",
                "join validation",
                toString(),
                "Add at least one left_column/right_column pair");
        }
        this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
    }

    public static JoinSpec of(String leftDataset, String rightDataset, JoinType joinType,
                              String leftColumn, String rightColumn) {
        return new JoinSpec(leftDataset, rightDataset, joinType,
            List.of(new JoinKey(leftColumn, rightColumn)));
    }

    public String leftDataset() {
        return leftDataset;
    }

    public String rightDataset() {
        return rightDataset;
    }

    public JoinType joinType() {
        return joinType;
    }

    public List<JoinKey> keys() {
        return keys;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JoinSpec that)) return false;
        return leftDataset.equals(that.leftDataset) &&
               rightDataset.equals(that.rightDataset) &&
               joinType == that.joinType &&
               Objects.equals(keys, that.keys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(leftDataset, rightDataset, joinType, keys);
    }

    @Override
    public String toString() {
        return String.format("JoinSpec(%s %s %s, on=%s)", leftDataset, joinType, rightDataset, keys);
    }

    /**
     * A pair of columns to join on.
     */
    public record JoinKey(String leftColumn, String rightColumn) {

        public JoinKey {
            Objects.requireNonNull(leftColumn, "leftColumn must not be null");
            Objects.requireNonNull(rightColumn, "rightColumn must not be null");
        }

        @Override
        public String toString() {
            return leftColumn + " = " + rightColumn;
        }
    }

    /**
     * Supported join types.
     */
    public enum JoinType {
        INNER("INNER JOIN"),
        LEFT("LEFT JOIN"),
        RIGHT("RIGHT JOIN"),
        OUTER("FULL OUTER JOIN");

        private final String keyword;

        JoinType(String keyword) {
            this.keyword = keyword;
        }

        /**
         * Returns the SQL keyword for this join type.
         *
         * @return the JOIN keyword
         */
        public String keyword() {
            return keyword;
        }

        /**
         * Parses a join type token (case-insensitive), defaulting to INNER.
         *
         * @param value the token
         * @return the join type
         * @throws ValidationException if the token is not recognized
         */
        public static JoinType fromToken(String value) {
            if (value == null || value.isBlank()) {
                return INNER;
            }
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "inner":
                    return INNER;
                case "left":
                    return LEFT;
                case "right":
                    return RIGHT;
                case "outer":
                case "full":
                    return OUTER;
                default:
                    throw new ValidationException(
                        "Unknown join type: '" + value + "'",
                        "join validation",
                        value,
                        "Use one of: inner, left, right, outer");
            }
        }
    }
}
