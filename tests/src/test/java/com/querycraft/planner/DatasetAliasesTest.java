package com.querycraft.planner;

import com.querycraft.planner.DatasetAliases.ColumnReference;
import com.querycraft.planner.DatasetAliases.Occurrence;
import com.querycraft.request.JoinSpec;
import com.querycraft.request.JoinSpec.JoinType;
import com.querycraft.request.QueryRequest;
import com.querycraft.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("DatasetAliases Tests")
class DatasetAliasesTest {

    private static DatasetAliases selfJoin() {
        return DatasetAliases.of(QueryRequest.builder("ORDERS")
            .join(JoinSpec.of("ORDERS", "ORDERS", JoinType.INNER, "PARENT_ID", "ID"))
            .build());
    }

    @Nested
    @DisplayName("Alias assignment")
    class AliasAssignment {

        @Test
        @DisplayName("Repeated datasets get numbered aliases")
        void testSelfJoinAliases() {
            DatasetAliases aliases = selfJoin();

            assertThat(aliases.all()).extracting(Occurrence::alias).containsExactly("ORDERS", "ORDERS_1");
            assertThat(aliases.base().isBase()).isTrue();
            assertThat(aliases.forJoin(0).index()).isEqualTo(1);
        }

        @Test
        @DisplayName("Schema dots are flattened and repeats are counted case-insensitively")
        void testSchemaAliases() {
            DatasetAliases aliases = DatasetAliases.of(QueryRequest.builder("hr.emp")
                .join(JoinSpec.of("hr.emp", "HR.EMP", JoinType.LEFT, "MANAGER_ID", "ID"))
                .join(JoinSpec.of("hr.emp", "HR.DEPT", JoinType.INNER, "DEPT_ID", "ID"))
                .build());

            assertThat(aliases.all()).extracting(Occurrence::alias).containsExactly("hr_emp", "HR_EMP_1", "HR_DEPT");
        }

        @Test
        @DisplayName("A numbered alias skips names already taken by another dataset")
        void testNumberedAliasSkipsTakenName() {
            DatasetAliases aliases = DatasetAliases.of(QueryRequest.builder("ORDERS")
                .join(JoinSpec.of("ORDERS", "ORDERS_1", JoinType.INNER, "ID", "ID"))
                .join(JoinSpec.of("ORDERS", "ORDERS", JoinType.INNER, "PARENT_ID", "ID"))
                .join(JoinSpec.of("ORDERS", "orders", JoinType.LEFT, "ROOT_ID", "ID"))
                .build());

            assertThat(aliases.all()).extracting(Occurrence::alias)
                .containsExactly("ORDERS", "ORDERS_1", "ORDERS_2", "orders_3");
            assertThat(aliases.resolve("ORDERS_2.STATUS").occurrence().index()).isEqualTo(2);
        }

        @Test
        @DisplayName("A dataset named like an earlier generated alias is renumbered")
        void testDatasetNamedLikeGeneratedAlias() {
            DatasetAliases aliases = DatasetAliases.of(QueryRequest.builder("ORDERS")
                .join(JoinSpec.of("ORDERS", "ORDERS", JoinType.INNER, "PARENT_ID", "ID"))
                .join(JoinSpec.of("ORDERS", "ORDERS_1", JoinType.INNER, "ID", "ID"))
                .build());

            assertThat(aliases.all()).extracting(Occurrence::alias)
                .containsExactly("ORDERS", "ORDERS_1", "ORDERS_1_1");
        }
    }

    @Nested
    @DisplayName("Column resolution")
    class ColumnResolution {

        @Test
        @DisplayName("Unqualified columns belong to the base dataset")
        void testUnqualified() {
            ColumnReference ref = selfJoin().resolve("STATUS");

            assertThat(ref.occurrence().isBase()).isTrue();
            assertThat(ref.qualifier()).isNull();
            assertThat(ref.column()).isEqualTo("STATUS");
        }

        @Test
        @DisplayName("A dataset name resolves to its first occurrence, a generated alias to its own")
        void testSelfJoinResolution() {
            DatasetAliases aliases = selfJoin();

            assertThat(aliases.resolve("ORDERS.STATUS").occurrence().index()).isEqualTo(0);
            assertThat(aliases.resolve("orders_1.STATUS").occurrence().index()).isEqualTo(1);
        }

        @Test
        @DisplayName("Table names resolve schema-qualified datasets")
        void testTableSuffix() {
            DatasetAliases aliases = DatasetAliases.of(QueryRequest.builder("HR.EMP")
                .join(JoinSpec.of("HR.EMP", "HR.DEPT", JoinType.INNER, "DEPT_ID", "ID"))
                .build());

            assertThat(aliases.resolve("HR.DEPT.NAME").occurrence().alias()).isEqualTo("HR_DEPT");
            assertThat(aliases.resolve("DEPT.NAME").occurrence().alias()).isEqualTo("HR_DEPT");
        }

        @Test
        @DisplayName("Unknown qualifiers are kept but unresolved")
        void testUnknownQualifier() {
            ColumnReference ref = selfJoin().resolve("CUSTOMERS.NAME");

            assertThat(ref.isResolved()).isFalse();
            assertThat(ref.qualifier()).isEqualTo("CUSTOMERS");
            assertThat(ref.column()).isEqualTo("NAME");
        }

        @Test
        @DisplayName("Blank references do not resolve")
        void testBlank() {
            assertThat(selfJoin().resolve("  ")).isNull();
            assertThat(selfJoin().resolve("ORDERS.")).isNull();
        }
    }
}
