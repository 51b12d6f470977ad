package com.querycraft.generator;

import com.querycraft.filter.FilterCondition;
import com.querycraft.types.ResolvedColumnType;

/**
 * The context a filter tree is compiled in: how column references become SQL
 * and which of them name aggregation outputs.
 *
 * <p>The outer statement resolves columns to {@code "ALIAS"."COLUMN"} and knows
 * the request's aggregations; a derived source resolves columns of its single
 * dataset without a qualifier and never sees aggregates.
 */
public interface FilterScope {

    /**
     * Returns whether a condition targets an aggregation output alias.
     *
     * @param condition the condition
     * @return true if the condition must be evaluated after grouping
     */
    boolean isAggregated(FilterCondition condition);

    /**
     * Renders the column expression a condition compares.
     *
     * @param condition the condition
     * @param inHaving whether the condition is compiled into HAVING; raw
     *                 columns must then be grouped or wrapped in an aggregate
     * @return the quoted expression, or an empty string if the reference cannot be resolved
     */
    String columnSql(FilterCondition condition, boolean inHaving);

    /**
     * Resolves the type a condition is compiled for.
     *
     * @param condition the condition
     * @return the resolved type
     */
    ResolvedColumnType typeOf(FilterCondition condition);
}
