package com.querycraft.validation;

import com.querycraft.config.CompilerSettings;
import com.querycraft.exception.ValidationException;
import com.querycraft.request.AggregationSpec;
import com.querycraft.request.QueryRequest;
import com.querycraft.test.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("RequestValidator Tests")
class RequestValidatorTest {

    private RequestValidator validator;

    @BeforeEach
    void setUp() {
        validator = new RequestValidator(new CompilerSettings(50, 999, 1000, "unnamed_metric"));
    }

    @Test
    @DisplayName("A well-formed request passes")
    void testValid() {
        assertThatCode(() -> validator.validate(QueryRequest.builder("EMP").columns("ID").build(), false))
            .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("The dataset must be named")
    void testBlankDataset() {
        assertThatThrownBy(() -> validator.validate(QueryRequest.builder(" ").columns("ID").build(), false))
            .isInstanceOfSatisfying(ValidationException.class, e -> {
                assertThat(e.phase()).isEqualTo("request validation");
                assertThat(e.suggestion()).isNotBlank();
            });
    }

    @Nested
    @DisplayName("Projection")
    class Projection {

        @Test
        @DisplayName("Data queries need columns or aggregations")
        void testNoColumns() {
            QueryRequest empty = QueryRequest.builder("EMP").build();
            QueryRequest aggregated = QueryRequest.builder("EMP")
                .aggregation(new AggregationSpec("ID", AggregationSpec.Function.COUNT, null))
                .build();

            assertThatThrownBy(() -> validator.validate(empty, false)).isInstanceOf(ValidationException.class);
            assertThatCode(() -> validator.validate(aggregated, false)).doesNotThrowAnyException();
            assertThatCode(() -> validator.validate(empty, true)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Aggregations must name a column")
        void testBlankAggregationColumn() {
            QueryRequest request = QueryRequest.builder("EMP")
                .aggregation(new AggregationSpec(" ", AggregationSpec.Function.SUM, "total"))
                .build();

            assertThatThrownBy(() -> validator.validate(request, false))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("sum");
        }
    }

    @Nested
    @DisplayName("Paging")
    class Paging {

        @ParameterizedTest
        @ValueSource(ints = {0, -1, 1001})
        @DisplayName("Limits outside 1..max are rejected")
        void testLimitOutOfRange(int limit) {
            QueryRequest request = QueryRequest.builder("EMP").columns("ID").limit(limit).build();

            assertThatThrownBy(() -> validator.validate(request, false))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("out of range");
        }

        @Test
        @DisplayName("Negative offsets are rejected")
        void testNegativeOffset() {
            QueryRequest request = QueryRequest.builder("EMP").columns("ID").offset(-5).build();

            assertThatThrownBy(() -> validator.validate(request, false)).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Count queries ignore paging")
        void testCountIgnoresPaging() {
            QueryRequest request = QueryRequest.builder("EMP").limit(0).offset(-1).build();

            assertThatCode(() -> validator.validate(request, true)).doesNotThrowAnyException();
        }
    }
}
