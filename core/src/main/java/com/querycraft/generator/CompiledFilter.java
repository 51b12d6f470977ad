package com.querycraft.generator;

/**
 * A filter tree split into the part evaluated before grouping and the part
 * evaluated after it.
 *
 * @param where the WHERE predicate, or an empty string
 * @param having the HAVING predicate, or an empty string
 */
public record CompiledFilter(String where, String having) {

    public static final CompiledFilter EMPTY = new CompiledFilter("", "");

    public boolean hasWhere() {
        return !where.isEmpty();
    }

    public boolean hasHaving() {
        return !having.isEmpty();
    }
}
