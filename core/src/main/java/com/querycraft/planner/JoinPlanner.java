package com.querycraft.planner;

import com.querycraft.exception.SQLGenerationException;
import com.querycraft.filter.LogicalGroup;
import com.querycraft.generator.ColumnResolver;
import com.querycraft.generator.CompiledFilter;
import com.querycraft.generator.LogicalGroupCompiler;
import com.querycraft.generator.ParamGenerator;
import com.querycraft.planner.DatasetAliases.Occurrence;
import com.querycraft.request.JoinSpec;
import com.querycraft.request.JoinSpec.JoinType;
import com.querycraft.request.QueryRequest;
import com.querycraft.types.ColumnTypeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.querycraft.generator.SQLQuoting.quoteIdentifier;

/**
 * Builds the FROM and JOIN clauses of a request.
 *
 * <p>Each dataset occurrence becomes either its plain table or, when it has
 * partition or pushed-down predicates, a filtered derived source:
 * <pre>
 *   "HR"."EMP" "HR_EMP"
 *   (SELECT * FROM "HR"."EMP" WHERE "AS_OF_MONTH_SK" = :part_HR_EMP_1 AND ("DEPT_ID" = :p_2)) "HR_EMP"
 * </pre>
 *
 * <p>Joins from the base dataset are reordered so the one with the most
 * pushed-down conditions runs first; joins that start from a joined dataset
 * keep their relative order and follow. Joins are kept in request order when
 * any RIGHT or FULL OUTER join is present.
 *
 * <p>Sources are rendered in final join order, so their bind parameters are
 * numbered in the order they appear in the statement.
 */
public class JoinPlanner {

    private static final Logger logger = LoggerFactory.getLogger(JoinPlanner.class);

    private final PartitionPredicateInjector partitionInjector;
    private final LogicalGroupCompiler groupCompiler;

    public JoinPlanner(PartitionPredicateInjector partitionInjector, LogicalGroupCompiler groupCompiler) {
        this.partitionInjector = Objects.requireNonNull(partitionInjector, "partitionInjector must not be null");
        this.groupCompiler = Objects.requireNonNull(groupCompiler, "groupCompiler must not be null");
    }

    /**
     * The rendered FROM source and JOIN clauses.
     *
     * @param from the base source, e.g. {@code "EMP" "EMP"}
     * @param joins the JOIN clauses in execution order
     */
    public record JoinPlan(String from, List<String> joins) {

        public JoinPlan {
            joins = List.copyOf(joins);
        }
    }

    /**
     * Plans the FROM/JOIN chain of a request.
     *
     * @param request the request
     * @param columns resolves columns and tables of the request
     * @param pushdown the filters pushed into each occurrence
     * @param types resolves column types for pushed filters and partition values
     * @param params the parameter generator of this compilation
     * @return the plan
     * @throws SQLGenerationException if a join starts from a dataset that is not yet joined
     */
    public JoinPlan plan(QueryRequest request, ColumnResolver columns, PushdownPlan pushdown,
                         ColumnTypeResolver types, ParamGenerator params) {
        DatasetAliases aliases = columns.aliases();
        String from = source(aliases.base(), request, columns, pushdown, types, params);

        Set<Occurrence> inScope = new HashSet<>();
        inScope.add(aliases.base());

        List<String> clauses = new ArrayList<>();
        for (int index : joinOrder(request, aliases, pushdown)) {
            JoinSpec join = request.joins().get(index);
            Occurrence right = aliases.forJoin(index);
            Occurrence left = aliases.resolveQualifier(join.leftDataset(), inScope::contains);
            if (left == null) {
                throw new SQLGenerationException(
                    "Join starts from '" + join.leftDataset() + "', which is not part of the query at that point",
                    join);
            }

            String rightSource = source(right, request, columns, pushdown, types, params);
            List<String> conditions = new ArrayList<>(join.keys().size());
            for (JoinSpec.JoinKey key : join.keys()) {
                conditions.add(columns.qualified(left, key.leftColumn()) + " = "
                    + columns.qualified(right, key.rightColumn()));
            }
            clauses.add(join.joinType().keyword() + " " + rightSource + " ON " + String.join(" AND ", conditions));
            inScope.add(right);
        }

        return new JoinPlan(from, clauses);
    }

    /**
     * Returns the order joins are emitted in, as indexes into the request's joins.
     *
     * @param request the request
     * @param aliases the occurrences
     * @param pushdown the pushed filters deciding each join's weight
     * @return join indexes in execution order
     */
    static List<Integer> joinOrder(QueryRequest request, DatasetAliases aliases, PushdownPlan pushdown) {
        List<JoinSpec> joins = request.joins();
        List<Integer> order = new ArrayList<>(joins.size());
        boolean reorder = true;
        for (int i = 0; i < joins.size(); i++) {
            order.add(i);
            JoinType type = joins.get(i).joinType();
            if (type == JoinType.RIGHT || type == JoinType.OUTER) {
                reorder = false;
            }
        }
        if (!reorder || joins.size() < 2) {
            return order;
        }

        List<Integer> fromBase = new ArrayList<>();
        List<Integer> dependent = new ArrayList<>();
        for (int i : order) {
            if (aliases.resolveQualifier(joins.get(i).leftDataset(), Occurrence::isBase) != null) {
                fromBase.add(i);
            } else {
                dependent.add(i);
            }
        }
        // List.sort is stable, so equal weights keep request order
        fromBase.sort(Comparator.comparingInt((Integer i) -> pushdown.weightOf(aliases.forJoin(i))).reversed());

        List<Integer> reordered = new ArrayList<>(fromBase);
        reordered.addAll(dependent);
        if (!reordered.equals(order)) {
            logger.debug("Reordered joins by pushed-down weight: {} -> {}", order, reordered);
        }
        return reordered;
    }

    private String source(Occurrence occurrence, QueryRequest request, ColumnResolver columns,
                          PushdownPlan pushdown, ColumnTypeResolver types, ParamGenerator params) {
        List<String> predicates = new ArrayList<>(
            partitionInjector.predicatesFor(occurrence.dataset(), request, types, params));

        LogicalGroup pushed = pushdown.pushedTo(occurrence);
        if (pushed != null) {
            CompiledFilter compiled = groupCompiler.compile(
                pushed, new DerivedSourceScope(occurrence.dataset(), columns, types), params);
            if (compiled.hasWhere()) {
                boolean needsParens = pushed.logic() == LogicalGroup.Logic.OR && !predicates.isEmpty();
                predicates.add(needsParens ? "(" + compiled.where() + ")" : compiled.where());
            }
        }

        String table = columns.table(occurrence);
        String alias = quoteIdentifier(occurrence.alias());
        if (predicates.isEmpty()) {
            return table + " " + alias;
        }
        return "(SELECT * FROM " + table + " WHERE " + String.join(" AND ", predicates) + ") " + alias;
    }
}
