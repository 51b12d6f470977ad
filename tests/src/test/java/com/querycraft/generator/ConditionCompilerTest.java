package com.querycraft.generator;

import com.querycraft.config.CompilerSettings;
import com.querycraft.exception.SQLGenerationException;
import com.querycraft.exception.ValidationException;
import com.querycraft.filter.ColumnDataType;
import com.querycraft.filter.FilterCondition;
import com.querycraft.filter.FilterOperator;
import com.querycraft.test.TestBase;
import com.querycraft.test.TestCategories;
import com.querycraft.types.ResolvedColumnType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.querycraft.filter.FilterOperator.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for single-condition compilation.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ConditionCompiler Tests")
public class ConditionCompilerTest extends TestBase {

    private static final String COL = "\"EMP\".\"NAME\"";
    private static final String NUM = "\"EMP\".\"SALARY\"";
    private static final String HIRED = "\"EMP\".\"HIRED\"";

    private ConditionCompiler compiler;
    private ParamGenerator params;

    @BeforeEach
    void setUp() {
        compiler = new ConditionCompiler(CompilerSettings.defaults());
        params = new ParamGenerator();
    }

    private String compile(FilterCondition condition, String columnSql) {
        return compiler.compile(condition, columnSql, ResolvedColumnType.of(condition.dataType()), params);
    }

    @Nested
    @DisplayName("Text matching")
    class TextMatching {

        @Test
        @DisplayName("contains matches case-insensitively with a bound pattern")
        void testContains() {
            String sql = compile(text("NAME", CONTAINS, "Jo"), COL);

            assertThat(sql).isEqualTo("UPPER(CAST(\"EMP\".\"NAME\" AS VARCHAR2(4000))) LIKE UPPER(:p_1)");
            assertThat(params.params()).containsExactly(entry("p_1", "%JO%"));
        }

        @ParameterizedTest(name = "{0} {1} -> {2} / {3}")
        @CsvSource({
            "starts_with, ab, LIKE, AB%",
            "ends_with, ab, LIKE, %AB",
            "not_contains, ab, NOT LIKE, %AB%"
        })
        @DisplayName("Wildcard operators build their patterns")
        void testWildcardPatterns(String operator, String value, String keyword, String pattern) {
            String sql = compile(text("NAME", FilterOperator.fromToken(operator), value), COL);

            assertThat(sql).isEqualTo("UPPER(CAST(\"EMP\".\"NAME\" AS VARCHAR2(4000))) " + keyword + " UPPER(:p_1)");
            assertThat(params.params()).containsEntry("p_1", pattern);
        }

        @Test
        @DisplayName("eq and neq compare upper-cased text")
        void testEquality() {
            String eq = compile(text("NAME", EQ, "smith"), COL);
            String neq = compile(text("NAME", NEQ, "Jones"), COL);

            assertThat(eq).isEqualTo("UPPER(CAST(\"EMP\".\"NAME\" AS VARCHAR2(4000))) = UPPER(:p_1)");
            assertThat(neq).isEqualTo("UPPER(CAST(\"EMP\".\"NAME\" AS VARCHAR2(4000))) != UPPER(:p_2)");
            assertThat(params.params()).containsExactly(entry("p_1", "SMITH"), entry("p_2", "JONES"));
        }
    }

    @Nested
    @DisplayName("Numbers and dates")
    class NumbersAndDates {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "gt, >",
            "gte, >=",
            "lt, <",
            "lte, <=",
            "eq, =",
            "neq, !="
        })
        @DisplayName("Number comparisons bind the raw value")
        void testNumberComparison(String operator, String symbol) {
            String sql = compile(number("SALARY", FilterOperator.fromToken(operator), 100), NUM);

            assertThat(sql).isEqualTo(NUM + " " + symbol + " :p_1");
            assertThat(params.params()).containsExactly(entry("p_1", 100));
        }

        @Test
        @DisplayName("Numbers match text patterns through TO_CHAR")
        void testNumberContains() {
            String sql = compile(number("SALARY", CONTAINS, "1.50"), NUM);

            assertThat(sql).isEqualTo(
                "UPPER(TO_CHAR(\"EMP\".\"SALARY\", 'TM', 'NLS_NUMERIC_CHARACTERS=''. ''')) LIKE UPPER(:p_1)");
            assertThat(params.params()).containsEntry("p_1", "%1.5%");
        }

        @Test
        @DisplayName("Date comparisons truncate the column to the day")
        void testDateComparison() {
            String eq = compile(date("HIRED", EQ, "2024-01-31"), HIRED);
            String gte = compile(date("HIRED", GTE, "2024-01-31T10:15:00"), HIRED);

            assertThat(eq).isEqualTo("TRUNC(\"EMP\".\"HIRED\") = :p_1");
            assertThat(gte).isEqualTo("TRUNC(\"EMP\".\"HIRED\") >= :p_2");
            assertThat(params.params().get("p_1")).isEqualTo(LocalDate.of(2024, 1, 31));
            assertThat(params.params().get("p_2")).isEqualTo(LocalDateTime.of(2024, 1, 31, 10, 15));
        }

        @Test
        @DisplayName("Dates match text patterns through their canonical rendering")
        void testDateContains() {
            String sql = compile(date("HIRED", CONTAINS, "2024-01"), HIRED);

            assertThat(sql).isEqualTo(
                "UPPER(TO_CHAR(\"EMP\".\"HIRED\", 'YYYY-MM-DD HH24:MI:SS')) LIKE UPPER(:p_1)");
            assertThat(params.params()).containsEntry("p_1", "%2024-01%");
        }

        @Test
        @DisplayName("Unparseable dates are bound unchanged")
        void testUnparseableDate() {
            compile(date("HIRED", EQ, "yesterday"), HIRED);

            assertThat(params.params()).containsEntry("p_1", "yesterday");
        }
    }

    @Nested
    @DisplayName("between")
    class Between {

        @Test
        @DisplayName("Both bounds compile to BETWEEN")
        void testBothBounds() {
            String sql = compile(number("SALARY", BETWEEN, List.of(10, 20)), NUM);

            assertThat(sql).isEqualTo(NUM + " BETWEEN :p_1 AND :p_2");
            assertThat(params.params()).containsExactly(entry("p_1", 10), entry("p_2", 20));
        }

        @Test
        @DisplayName("An open upper bound compiles to >=")
        void testOpenEnd() {
            assertThat(compile(number("SALARY", BETWEEN, Arrays.asList(10, "")), NUM))
                .isEqualTo(NUM + " >= :p_1");
        }

        @Test
        @DisplayName("An open lower bound compiles to <=")
        void testOpenStart() {
            assertThat(compile(number("SALARY", BETWEEN, Arrays.asList(null, 20)), NUM))
                .isEqualTo(NUM + " <= :p_1");
        }

        @Test
        @DisplayName("No bounds compiles to an always-true predicate")
        void testNoBounds() {
            assertThat(compile(number("SALARY", BETWEEN, Arrays.asList("", null)), NUM)).isEqualTo("1=1");
            assertThat(params.size()).isZero();
        }

        @Test
        @DisplayName("Date ranges are truncated and parsed")
        void testDateRange() {
            String sql = compile(date("HIRED", BETWEEN, List.of("2024-01-01", "2024-01-31")), HIRED);

            assertThat(sql).isEqualTo("TRUNC(\"EMP\".\"HIRED\") BETWEEN :p_1 AND :p_2");
            assertThat(params.params()).containsExactly(
                entry("p_1", LocalDate.of(2024, 1, 1)),
                entry("p_2", LocalDate.of(2024, 1, 31)));
        }

        @Test
        @DisplayName("A value that is not a pair is rejected")
        void testWrongShape() {
            assertThatThrownBy(() -> number("SALARY", BETWEEN, List.of(1)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("exactly 2 items");
            assertThatThrownBy(() -> number("SALARY", BETWEEN, 5))
                .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("In-lists")
    class InLists {

        @Test
        @DisplayName("Delimited text is split and upper-cased")
        void testDelimitedText() {
            String sql = compile(text("NAME", IN, "a, b\tc"), COL);

            assertThat(sql).isEqualTo("UPPER(CAST(\"EMP\".\"NAME\" AS VARCHAR2(4000))) IN (:p_1, :p_2, :p_3)");
            assertThat(params.params()).containsExactly(entry("p_1", "A"), entry("p_2", "B"), entry("p_3", "C"));
        }

        @Test
        @DisplayName("Number lists bind each value")
        void testNumberList() {
            String sql = compile(number("SALARY", NOT_IN, List.of(1, 2)), NUM);

            assertThat(sql).isEqualTo(NUM + " NOT IN (:p_1, :p_2)");
        }

        @Test
        @DisplayName("An empty list matches nothing for in and everything for not_in")
        void testEmptyList() {
            assertThat(compile(number("SALARY", IN, List.of()), NUM)).isEqualTo("1=0");
            assertThat(compile(number("SALARY", NOT_IN, List.of()), NUM)).isEqualTo("1=1");
        }

        @Test
        @DisplayName("A missing list is ignored")
        void testMissingList() {
            assertThat(compile(number("SALARY", IN, null), NUM)).isEqualTo("1=1");
            assertThat(compile(text("NAME", IN, "  "), COL)).isEqualTo("1=1");
        }

        @Test
        @DisplayName("Lists are capped at the configured size")
        void testListCap() {
            List<Integer> values = new ArrayList<>();
            for (int i = 0; i < 1500; i++) {
                values.add(i);
            }

            compile(number("SALARY", IN, values), NUM);

            assertThat(params.size()).isEqualTo(CompilerSettings.DEFAULT_MAX_IN_LIST_SIZE);
        }

        @Test
        @DisplayName("A smaller cap from settings is honored")
        void testCustomCap() {
            ConditionCompiler small = new ConditionCompiler(new CompilerSettings(50, 2, 1000, "metric"));

            String sql = small.compile(number("SALARY", IN, List.of(1, 2, 3)), NUM,
                ResolvedColumnType.of(ColumnDataType.NUMBER), params);

            assertThat(sql).isEqualTo(NUM + " IN (:p_1, :p_2)");
        }
    }

    @Nested
    @DisplayName("Null and empty checks")
    class NullChecks {

        @Test
        @DisplayName("Null checks bind nothing")
        void testNullChecks() {
            assertThat(compile(text("NAME", IS_NULL, null), COL)).isEqualTo(COL + " IS NULL");
            assertThat(compile(text("NAME", IS_NOT_NULL, "ignored"), COL)).isEqualTo(COL + " IS NOT NULL");
            assertThat(params.size()).isZero();
        }

        @Test
        @DisplayName("Empty checks on text also match the empty string")
        void testEmptyText() {
            assertThat(compile(text("NAME", IS_EMPTY, null), COL))
                .isEqualTo("(" + COL + " IS NULL OR " + COL + " = '')");
            assertThat(compile(text("NAME", IS_NOT_EMPTY, null), COL))
                .isEqualTo("(" + COL + " IS NOT NULL AND " + COL + " != '')");
        }

        @Test
        @DisplayName("Empty checks on numbers are null checks")
        void testEmptyNumber() {
            assertThat(compile(number("SALARY", IS_EMPTY, null), NUM)).isEqualTo(NUM + " IS NULL");
            assertThat(compile(number("SALARY", IS_NOT_EMPTY, null), NUM)).isEqualTo(NUM + " IS NOT NULL");
        }
    }

    @Nested
    @DisplayName("Degenerate input")
    class DegenerateInput {

        @Test
        @DisplayName("Missing values compile to an always-true predicate")
        void testMissingValue() {
            assertThat(compile(text("NAME", EQ, null), COL)).isEqualTo("1=1");
            assertThat(compile(text("NAME", CONTAINS, ""), COL)).isEqualTo("1=1");
            assertThat(compile(number("SALARY", GT, "   "), NUM)).isEqualTo("1=1");
            assertThat(params.size()).isZero();
        }

        @Test
        @DisplayName("An unresolved column compiles to an always-true predicate")
        void testBlankColumn() {
            assertThat(compile(text("NAME", EQ, "x"), "")).isEqualTo("1=1");
        }

        @Test
        @DisplayName("Operators not allowed for the declared type are rejected up front")
        void testOperatorNotAllowed() {
            assertThatThrownBy(() -> text("NAME", GT, 5))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not allowed");
        }

        @Test
        @DisplayName("Operators not allowed for the resolved type fail compilation")
        void testOperatorNotAllowedForResolvedType() {
            FilterCondition condition = number("CODE", GT, 5);

            assertThatThrownBy(() -> compiler.compile(condition, "\"EMP\".\"CODE\"",
                    ResolvedColumnType.of(ColumnDataType.STRING), params))
                .isInstanceOfSatisfying(SQLGenerationException.class,
                    e -> assertThat(e.context()).isEqualTo(condition));
        }

        @Test
        @DisplayName("Decimal values are bound as given")
        void testDecimalBinding() {
            compile(number("SALARY", GT, new BigDecimal("10.5")), NUM);

            assertThat(params.params()).containsEntry("p_1", new BigDecimal("10.5"));
        }
    }
}
