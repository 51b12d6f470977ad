package com.querycraft.planner;

import com.querycraft.filter.FilterCondition;
import com.querycraft.filter.LogicalGroup;
import com.querycraft.planner.DatasetAliases.Occurrence;
import com.querycraft.request.JoinSpec;
import com.querycraft.request.JoinSpec.JoinType;
import com.querycraft.request.QueryRequest;
import com.querycraft.test.TestBase;
import com.querycraft.test.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.function.Predicate;

import static com.querycraft.filter.FilterOperator.EQ;
import static com.querycraft.filter.FilterOperator.GT;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for splitting filter trees into per-dataset pushed groups.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("PredicatePushdownPlanner Tests")
public class PredicatePushdownPlannerTest extends TestBase {

    private static final Predicate<String> NO_AGGREGATES = name -> false;

    private PredicatePushdownPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new PredicatePushdownPlanner();
    }

    private PushdownPlan plan(QueryRequest request, Predicate<String> isAggregationAlias) {
        return planner.plan(request, DatasetAliases.of(request), isAggregationAlias);
    }

    @Test
    @DisplayName("Unfiltered requests push nothing")
    void testNoFilters() {
        assertThat(plan(QueryRequest.builder("EMP").build(), NO_AGGREGATES)).isSameAs(PushdownPlan.NONE);
    }

    @Nested
    @DisplayName("AND groups")
    class AndGroups {

        @Test
        @DisplayName("Conditions are pushed into the dataset they reference")
        void testSplitAcrossDatasets() {
            FilterCondition salary = number("SALARY", GT, 10);
            FilterCondition deptName = text("DEPT.NAME", EQ, "X");
            LogicalGroup mixedOr = LogicalGroup.or(number("SALARY", GT, 1), text("DEPT.NAME", EQ, "Y"));
            QueryRequest request = QueryRequest.builder("EMP")
                .join(JoinSpec.of("EMP", "DEPT", JoinType.INNER, "DEPT_ID", "ID"))
                .filters(LogicalGroup.and(salary, deptName, mixedOr))
                .build();
            DatasetAliases aliases = DatasetAliases.of(request);

            PushdownPlan plan = planner.plan(request, aliases, NO_AGGREGATES);

            assertThat(plan.pushedTo(aliases.base()).children()).containsExactly(salary);
            assertThat(plan.pushedTo(aliases.forJoin(0)).children()).containsExactly(deptName);
            assertThat(plan.remaining().children()).containsExactly(mixedOr);
            assertThat(plan.weightOf(aliases.base())).isEqualTo(1);
        }

        @Test
        @DisplayName("Fully pushed filters leave nothing behind")
        void testFullyPushed() {
            QueryRequest request = QueryRequest.builder("EMP")
                .filters(LogicalGroup.and(number("SALARY", GT, 10), text("NAME", EQ, "x")))
                .build();

            PushdownPlan plan = plan(request, NO_AGGREGATES);

            assertThat(plan.remaining()).isNull();
            assertThat(plan.weightOf(DatasetAliases.of(request).base())).isEqualTo(2);
        }

        @Test
        @DisplayName("Aggregation aliases are never pushed")
        void testAggregationAliasKept() {
            FilterCondition total = number("total", GT, 100);
            QueryRequest request = QueryRequest.builder("SALES")
                .filters(LogicalGroup.and(text("REGION", EQ, "NA"), total))
                .build();

            PushdownPlan plan = plan(request, "TOTAL"::equalsIgnoreCase);

            assertThat(plan.remaining().children()).containsExactly(total);
        }

        @Test
        @DisplayName("Empty nested groups are dropped")
        void testEmptyNestedGroup() {
            QueryRequest request = QueryRequest.builder("EMP")
                .filters(LogicalGroup.and(number("SALARY", GT, 10), LogicalGroup.or()))
                .build();

            PushdownPlan plan = plan(request, NO_AGGREGATES);

            assertThat(plan.remaining()).isNull();
            assertThat(plan.pushedTo(DatasetAliases.of(request).base()).leafCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("OR groups")
    class OrGroups {

        @Test
        @DisplayName("An OR over one dataset is pushed whole")
        void testSingleDatasetOr() {
            LogicalGroup filters = LogicalGroup.or(number("SALARY", GT, 1), number("BONUS", GT, 2));
            QueryRequest request = QueryRequest.builder("EMP").filters(filters).build();

            PushdownPlan plan = plan(request, NO_AGGREGATES);

            assertThat(plan.pushedTo(DatasetAliases.of(request).base())).isEqualTo(filters);
            assertThat(plan.remaining()).isNull();
        }

        @Test
        @DisplayName("An OR spanning datasets is kept whole")
        void testCrossDatasetOr() {
            LogicalGroup filters = LogicalGroup.or(number("SALARY", GT, 1), text("DEPT.NAME", EQ, "Y"));
            QueryRequest request = QueryRequest.builder("EMP")
                .join(JoinSpec.of("EMP", "DEPT", JoinType.INNER, "DEPT_ID", "ID"))
                .filters(filters)
                .build();

            PushdownPlan plan = plan(request, NO_AGGREGATES);

            assertThat(plan.pushed()).isEmpty();
            assertThat(plan.remaining()).isEqualTo(filters);
        }
    }

    @Nested
    @DisplayName("Join types")
    class JoinTypes {

        @Test
        @DisplayName("Only the base and INNER-joined datasets receive pushed conditions")
        void testEligibleOccurrences() {
            QueryRequest request = QueryRequest.builder("EMP")
                .join(JoinSpec.of("EMP", "DEPT", JoinType.LEFT, "DEPT_ID", "ID"))
                .join(JoinSpec.of("EMP", "LOC", JoinType.INNER, "LOC_ID", "ID"))
                .build();
            DatasetAliases aliases = DatasetAliases.of(request);

            assertThat(PredicatePushdownPlanner.eligibleOccurrences(request, aliases))
                .extracting(Occurrence::alias)
                .containsExactly("EMP", "LOC");
        }

        @Test
        @DisplayName("A RIGHT join disables pushdown entirely")
        void testRightJoin() {
            LogicalGroup filters = LogicalGroup.and(number("SALARY", GT, 1));
            QueryRequest request = QueryRequest.builder("EMP")
                .join(JoinSpec.of("EMP", "DEPT", JoinType.RIGHT, "DEPT_ID", "ID"))
                .filters(filters)
                .build();

            PushdownPlan plan = plan(request, NO_AGGREGATES);

            assertThat(plan.pushed()).isEmpty();
            assertThat(plan.remaining()).isEqualTo(filters);
        }
    }
}
