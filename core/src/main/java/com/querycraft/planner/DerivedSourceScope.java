package com.querycraft.planner;

import com.querycraft.filter.FilterCondition;
import com.querycraft.generator.ColumnResolver;
import com.querycraft.generator.FilterScope;
import com.querycraft.types.ColumnTypeResolver;
import com.querycraft.types.ResolvedColumnType;

/**
 * Filter scope inside {@code (SELECT * FROM table WHERE ...)} for one dataset:
 * columns are unqualified and nothing is aggregated.
 */
class DerivedSourceScope implements FilterScope {

    private final String dataset;
    private final ColumnResolver columns;
    private final ColumnTypeResolver types;

    DerivedSourceScope(String dataset, ColumnResolver columns, ColumnTypeResolver types) {
        this.dataset = dataset;
        this.columns = columns;
        this.types = types;
    }

    @Override
    public boolean isAggregated(FilterCondition condition) {
        return false;
    }

    @Override
    public String columnSql(FilterCondition condition, boolean inHaving) {
        if (condition.column().isBlank()) {
            return "";
        }
        return columns.local(dataset, condition.column());
    }

    @Override
    public ResolvedColumnType typeOf(FilterCondition condition) {
        return types.resolve(condition);
    }
}
