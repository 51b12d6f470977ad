package com.querycraft.generator;

import com.querycraft.filter.FilterCondition;
import com.querycraft.filter.FilterNode;
import com.querycraft.filter.LogicalGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles an AND/OR filter tree into WHERE and HAVING predicates.
 *
 * <p>Routing rules:
 * <ul>
 *   <li>A condition on an aggregation output goes to HAVING, compared against
 *       the aggregate expression.</li>
 *   <li>A condition on a raw column goes to WHERE.</li>
 *   <li>An OR group containing any aggregation condition cannot be split
 *       across the two clauses, so the whole group goes to HAVING. Its raw
 *       conditions then compare the grouped column, or {@code MAX(column)} when
 *       the column is not grouped.</li>
 *   <li>AND groups are split freely; their WHERE and HAVING halves are each
 *       joined with AND.</li>
 * </ul>
 *
 * <p>Every condition is wrapped in parentheses. A nested empty group compiles
 * to {@code 1=1}.
 */
public class LogicalGroupCompiler {

    private final ConditionCompiler conditionCompiler;

    public LogicalGroupCompiler(ConditionCompiler conditionCompiler) {
        this.conditionCompiler = Objects.requireNonNull(conditionCompiler, "conditionCompiler must not be null");
    }

    /**
     * Compiles a filter tree.
     *
     * @param group the root group (null or empty compiles to nothing)
     * @param scope how columns resolve
     * @param params the parameter generator of this compilation
     * @return the WHERE and HAVING predicates
     */
    public CompiledFilter compile(LogicalGroup group, FilterScope scope, ParamGenerator params) {
        if (group == null || group.isEmpty()) {
            return CompiledFilter.EMPTY;
        }
        return compileGroup(group, scope, params, false);
    }

    private CompiledFilter compileGroup(LogicalGroup group, FilterScope scope, ParamGenerator params,
                                        boolean promoted) {
        if (group.isEmpty()) {
            return promoted
                ? new CompiledFilter("", ConditionCompiler.ALWAYS_TRUE)
                : new CompiledFilter(ConditionCompiler.ALWAYS_TRUE, "");
        }

        boolean inHaving = promoted
            || (group.logic() == LogicalGroup.Logic.OR && referencesAggregate(group, scope));

        List<String> where = new ArrayList<>();
        List<String> having = new ArrayList<>();

        for (FilterNode child : group.children()) {
            if (child instanceof FilterCondition condition) {
                boolean toHaving = inHaving || scope.isAggregated(condition);
                String sql = conditionCompiler.compile(
                    condition, scope.columnSql(condition, toHaving), scope.typeOf(condition), params);
                (toHaving ? having : where).add("(" + sql + ")");
            } else {
                CompiledFilter nested = compileGroup((LogicalGroup) child, scope, params, inHaving);
                if (nested.hasWhere()) {
                    where.add("(" + nested.where() + ")");
                }
                if (nested.hasHaving()) {
                    having.add("(" + nested.having() + ")");
                }
            }
        }

        String separator = group.logic().separator();
        return new CompiledFilter(String.join(separator, where), String.join(separator, having));
    }

    /**
     * Returns whether any condition below a node targets an aggregation output.
     *
     * @param node the node
     * @param scope the scope deciding what is aggregated
     * @return true if at least one leaf is aggregated
     */
    static boolean referencesAggregate(FilterNode node, FilterScope scope) {
        if (node instanceof FilterCondition condition) {
            return scope.isAggregated(condition);
        }
        for (FilterNode child : ((LogicalGroup) node).children()) {
            if (referencesAggregate(child, scope)) {
                return true;
            }
        }
        return false;
    }
}
