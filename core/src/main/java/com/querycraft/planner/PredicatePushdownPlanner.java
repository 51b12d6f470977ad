package com.querycraft.planner;

import com.querycraft.filter.FilterCondition;
import com.querycraft.filter.FilterNode;
import com.querycraft.filter.LogicalGroup;
import com.querycraft.planner.DatasetAliases.ColumnReference;
import com.querycraft.planner.DatasetAliases.Occurrence;
import com.querycraft.request.JoinSpec;
import com.querycraft.request.JoinSpec.JoinType;
import com.querycraft.request.QueryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Moves filter conditions into the dataset they target so they run before joins.
 *
 * <p>The filter tree is split once per eligible occurrence, base dataset first:
 * <ul>
 *   <li>A condition is pushable when its column resolves to the occurrence and
 *       it does not name an aggregation output.</li>
 *   <li>An AND group pushes each pushable child and keeps the rest.</li>
 *   <li>An OR group is pushed whole only if every child is pushable to the same
 *       occurrence; otherwise it stays, since pushing part of an OR changes the
 *       row set.</li>
 * </ul>
 * Whatever is left after every occurrence has been tried is the global filter.
 *
 * <p>Only occurrences whose rows cannot be null-extended are eligible: the
 * base dataset and the right side of inner joins. With any RIGHT or FULL
 * OUTER join in the request nothing is pushed.
 */
public class PredicatePushdownPlanner {

    private static final Logger logger = LoggerFactory.getLogger(PredicatePushdownPlanner.class);

    /**
     * Plans pushdown for a request.
     *
     * @param request the request
     * @param aliases the occurrences of the request
     * @param isAggregationAlias tells which column names are aggregation outputs
     * @return the plan
     */
    public PushdownPlan plan(QueryRequest request, DatasetAliases aliases, Predicate<String> isAggregationAlias) {
        LogicalGroup filters = request.filters();
        if (filters == null || filters.isEmpty()) {
            return PushdownPlan.NONE;
        }

        Map<Occurrence, LogicalGroup> pushed = new LinkedHashMap<>();
        FilterNode remaining = filters;

        for (Occurrence occurrence : eligibleOccurrences(request, aliases)) {
            Split split = split(remaining, occurrence, aliases, isAggregationAlias);
            if (split.pushed != null) {
                LogicalGroup group = asGroup(split.pushed);
                pushed.put(occurrence, group);
                logger.debug("Pushing {} condition(s) into {}", group.leafCount(), occurrence);
            }
            remaining = split.remaining;
            if (remaining == null) {
                break;
            }
        }

        return new PushdownPlan(pushed, remaining == null ? null : asGroup(remaining));
    }

    /**
     * Returns the occurrences filters may be pushed into.
     *
     * @param request the request
     * @param aliases the occurrences
     * @return eligible occurrences, base first
     */
    static List<Occurrence> eligibleOccurrences(QueryRequest request, DatasetAliases aliases) {
        List<JoinSpec> joins = request.joins();
        for (JoinSpec join : joins) {
            if (join.joinType() == JoinType.RIGHT || join.joinType() == JoinType.OUTER) {
                return List.of();
            }
        }
        List<Occurrence> eligible = new ArrayList<>();
        eligible.add(aliases.base());
        for (int i = 0; i < joins.size(); i++) {
            if (joins.get(i).joinType() == JoinType.INNER) {
                eligible.add(aliases.forJoin(i));
            }
        }
        return eligible;
    }

    private Split split(FilterNode node, Occurrence target, DatasetAliases aliases,
                        Predicate<String> isAggregationAlias) {
        if (node instanceof FilterCondition condition) {
            return isPushable(condition, target, aliases, isAggregationAlias)
                ? new Split(condition, null)
                : new Split(null, condition);
        }

        LogicalGroup group = (LogicalGroup) node;
        if (group.isEmpty()) {
            return new Split(null, null);
        }

        if (group.logic() == LogicalGroup.Logic.OR) {
            for (FilterNode child : group.children()) {
                if (split(child, target, aliases, isAggregationAlias).remaining != null) {
                    return new Split(null, group);
                }
            }
            return new Split(group, null);
        }

        List<FilterNode> pushed = new ArrayList<>();
        List<FilterNode> kept = new ArrayList<>();
        for (FilterNode child : group.children()) {
            Split childSplit = split(child, target, aliases, isAggregationAlias);
            if (childSplit.pushed != null) {
                pushed.add(childSplit.pushed);
            }
            if (childSplit.remaining != null) {
                kept.add(childSplit.remaining);
            }
        }
        return new Split(
            pushed.isEmpty() ? null : new LogicalGroup(LogicalGroup.Logic.AND, pushed),
            kept.isEmpty() ? null : new LogicalGroup(LogicalGroup.Logic.AND, kept));
    }

    private static boolean isPushable(FilterCondition condition, Occurrence target, DatasetAliases aliases,
                                      Predicate<String> isAggregationAlias) {
        if (condition.column().isBlank() || isAggregationAlias.test(condition.column())) {
            return false;
        }
        ColumnReference ref = aliases.resolve(condition.column());
        return ref != null && target.equals(ref.occurrence());
    }

    private static LogicalGroup asGroup(FilterNode node) {
        return node instanceof LogicalGroup group
            ? group
            : new LogicalGroup(LogicalGroup.Logic.AND, List.of(node));
    }

    private static final class Split {
        final FilterNode pushed;
        final FilterNode remaining;

        Split(FilterNode pushed, FilterNode remaining) {
            this.pushed = pushed;
            this.remaining = remaining;
        }
    }
}
