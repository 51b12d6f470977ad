package com.querycraft.generator;

import java.util.List;
import java.util.Objects;

/**
 * The clauses of a compiled SELECT statement, rendered by {@link #toSQL()}.
 *
 * <p>All clause fragments are already quoted and parameterized; this class
 * only decides their order and separators. Clauses are separated by line
 * breaks:
 * <pre>
 *   SELECT "EMP"."ID" AS "EMP.ID"
 *   FROM "EMP" "EMP"
 *   WHERE (UPPER(CAST("EMP"."NAME" AS VARCHAR2(4000))) LIKE UPPER(:p_1))
 *   ORDER BY "EMP"."ID" ASC
 *   OFFSET 0 ROWS FETCH NEXT 100 ROWS ONLY
 * </pre>
 *
 * @param hint whether to add the in-memory optimizer hint
 * @param selectItems the projection
 * @param from the base source
 * @param joins the JOIN clauses
 * @param where the WHERE predicate, or an empty string
 * @param groupBy the GROUP BY expressions
 * @param having the HAVING predicate, or an empty string
 * @param orderBy the ORDER BY items
 * @param paging the OFFSET/FETCH window, or null for none
 */
public record SelectStatement(
    boolean hint,
    List<String> selectItems,
    String from,
    List<String> joins,
    String where,
    List<String> groupBy,
    String having,
    List<String> orderBy,
    Paging paging) {

    /** Optimizer hint emitted after SELECT when requested */
    public static final String IN_MEMORY_HINT = "/*+ INMEMORY */";

    public SelectStatement {
        selectItems = List.copyOf(selectItems);
        Objects.requireNonNull(from, "from must not be null");
        joins = List.copyOf(joins);
        where = where == null ? "" : where;
        groupBy = List.copyOf(groupBy);
        having = having == null ? "" : having;
        orderBy = List.copyOf(orderBy);
        if (selectItems.isEmpty()) {
            throw new IllegalArgumentException("SELECT list must not be empty");
        }
    }

    /**
     * A row window.
     *
     * @param offset rows to skip
     * @param limit rows to return
     */
    public record Paging(int offset, int limit) {
    }

    /**
     * Returns this statement with a different projection.
     *
     * @param items the new SELECT items
     * @return the modified statement
     */
    public SelectStatement withSelectItems(List<String> items) {
        return new SelectStatement(hint, items, from, joins, where, groupBy, having, orderBy, paging);
    }

    /**
     * Returns this statement without ORDER BY and paging.
     *
     * @return the modified statement
     */
    public SelectStatement unordered() {
        return new SelectStatement(hint, selectItems, from, joins, where, groupBy, having, List.of(), null);
    }

    public String toSQL() {
        StringBuilder sql = new StringBuilder("SELECT ");
        if (hint) {
            sql.append(IN_MEMORY_HINT).append(' ');
        }
        sql.append(String.join(", ", selectItems));
        sql.append("\nFROM ").append(from);
        for (String join : joins) {
            sql.append('\n').append(join);
        }
        if (!where.isEmpty()) {
            sql.append("\nWHERE ").append(where);
        }
        if (!groupBy.isEmpty()) {
            sql.append("\nGROUP BY ").append(String.join(", ", groupBy));
        }
        if (!having.isEmpty()) {
            sql.append("\nHAVING ").append(having);
        }
        if (!orderBy.isEmpty()) {
            sql.append("\nORDER BY ").append(String.join(", ", orderBy));
        }
        if (paging != null) {
            sql.append("\nOFFSET ").append(paging.offset())
               .append(" ROWS FETCH NEXT ").append(paging.limit()).append(" ROWS ONLY");
        }
        return sql.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }
}
