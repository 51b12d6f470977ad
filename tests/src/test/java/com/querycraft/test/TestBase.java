package com.querycraft.test;

import com.querycraft.filter.ColumnDataType;
import com.querycraft.filter.FilterCondition;
import com.querycraft.filter.FilterOperator;
import com.querycraft.generator.CompiledQuery;
import com.querycraft.generator.SQLGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for compiler tests.
 *
 * <p>Provides a default generator (identity names, no partitions), shorthand
 * condition factories and step logging.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected SQLGenerator generator;

    @BeforeEach
    void setUpTestBase(TestInfo testInfo) {
        generator = new SQLGenerator();
        logger.debug("Running {}", testInfo.getDisplayName());
    }

    protected void logStep(String step) {
        logger.debug("  step: {}", step);
    }

    protected void logQuery(CompiledQuery query) {
        logger.debug("SQL:\n{}\nparams: {}", query.sql(), query.params());
    }

    protected static FilterCondition text(String column, FilterOperator operator, Object value) {
        return FilterCondition.of(column, ColumnDataType.STRING, operator, value);
    }

    protected static FilterCondition number(String column, FilterOperator operator, Object value) {
        return FilterCondition.of(column, ColumnDataType.NUMBER, operator, value);
    }

    protected static FilterCondition date(String column, FilterOperator operator, Object value) {
        return FilterCondition.of(column, ColumnDataType.DATE, operator, value);
    }
}
