package com.querycraft.filter;

/**
 * A node in a filter tree: either a leaf {@link FilterCondition} or a nested
 * {@link LogicalGroup}.
 *
 * <p>Trees are built bottom-up from immutable nodes, so they cannot contain cycles.
 */
public sealed interface FilterNode permits FilterCondition, LogicalGroup {

    /**
     * Returns the number of leaf conditions in this subtree.
     *
     * @return the leaf count (1 for a condition)
     */
    int leafCount();
}
