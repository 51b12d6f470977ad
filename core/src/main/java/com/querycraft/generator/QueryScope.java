package com.querycraft.generator;

import com.querycraft.filter.FilterCondition;
import com.querycraft.types.ColumnTypeResolver;
import com.querycraft.types.ResolvedColumnType;

import java.util.Objects;
import java.util.Set;

/**
 * Filter scope of the outer statement: columns are alias-qualified and
 * aggregation outputs resolve to their aggregate expressions.
 */
class QueryScope implements FilterScope {

    private final ColumnResolver columns;
    private final AggregationPlan aggregations;
    private final Set<String> groupedColumns;
    private final ColumnTypeResolver types;

    QueryScope(ColumnResolver columns, AggregationPlan aggregations, Set<String> groupedColumns,
               ColumnTypeResolver types) {
        this.columns = Objects.requireNonNull(columns, "columns must not be null");
        this.aggregations = Objects.requireNonNull(aggregations, "aggregations must not be null");
        this.groupedColumns = Objects.requireNonNull(groupedColumns, "groupedColumns must not be null");
        this.types = Objects.requireNonNull(types, "types must not be null");
    }

    @Override
    public boolean isAggregated(FilterCondition condition) {
        return aggregations.isAggregationAlias(condition.column());
    }

    @Override
    public String columnSql(FilterCondition condition, boolean inHaving) {
        String aggregate = aggregations.expressionFor(condition.column());
        if (aggregate != null) {
            return aggregate;
        }
        String column = columns.qualified(condition.column());
        if (!inHaving || column.isEmpty() || groupedColumns.contains(column)) {
            return column;
        }
        return "MAX(" + column + ")";
    }

    @Override
    public ResolvedColumnType typeOf(FilterCondition condition) {
        return types.resolve(condition);
    }
}
