package com.querycraft.generator;

import com.querycraft.config.CompilerSettings;
import com.querycraft.config.NameResolver;
import com.querycraft.config.PartitionConfigProvider;
import com.querycraft.config.TableConfigCache;
import com.querycraft.exception.SQLGenerationException;
import com.querycraft.exception.ValidationException;
import com.querycraft.planner.DatasetAliases;
import com.querycraft.planner.JoinPlanner;
import com.querycraft.planner.PartitionPredicateInjector;
import com.querycraft.planner.PredicatePushdownPlanner;
import com.querycraft.planner.PushdownPlan;
import com.querycraft.request.QueryRequest;
import com.querycraft.request.SortSpec;
import com.querycraft.types.ColumnTypeResolver;
import com.querycraft.validation.RequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.querycraft.generator.SQLQuoting.quoteAlias;
import static com.querycraft.generator.SQLQuoting.quoteIdentifier;

/**
 * Compiles a {@link QueryRequest} into one parameterized SQL statement.
 *
 * <p>Compilation runs in this order:
 * <ol>
 *   <li>validate the request shape</li>
 *   <li>assign an alias to every dataset occurrence</li>
 *   <li>build the aggregation SELECT list and learn the aggregation aliases</li>
 *   <li>push filter conditions into the datasets they target</li>
 *   <li>render FROM/JOIN, wrapping filtered datasets in derived sources</li>
 *   <li>compile the remaining filters into WHERE and HAVING</li>
 *   <li>add GROUP BY, ORDER BY and OFFSET/FETCH</li>
 * </ol>
 *
 * <p>The generator holds no per-compilation state and may be shared by any
 * number of threads.
 *
 * <p>Example usage:
 * <pre>
 *   SQLGenerator generator = new SQLGenerator(tableConfigCache, CompilerSettings.defaults());
 *   CompiledQuery query = generator.compile(request);
 *   CompiledQuery count = generator.compileCount(request);
 * </pre>
 *
 * @see QueryRequest
 * @see CompiledQuery
 */
public class SQLGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SQLGenerator.class);

    /** Projection of the row-count query */
    public static final String COUNT_PROJECTION = "COUNT(*) AS \"TOTAL_ROWS\"";

    private final NameResolver names;
    private final CompilerSettings settings;
    private final RequestValidator validator;
    private final AggregationCompiler aggregationCompiler;
    private final LogicalGroupCompiler groupCompiler;
    private final PredicatePushdownPlanner pushdownPlanner;
    private final JoinPlanner joinPlanner;

    /**
     * Creates a generator with identity name mapping and no partitioned datasets.
     */
    public SQLGenerator() {
        this(NameResolver.IDENTITY, PartitionConfigProvider.NONE, CompilerSettings.defaults());
    }

    /**
     * Creates a generator backed by a table configuration file.
     *
     * @param tableConfig the cache providing name mappings and partition layout
     * @param settings the compiler limits
     */
    public SQLGenerator(TableConfigCache tableConfig, CompilerSettings settings) {
        this(tableConfig, tableConfig, settings);
    }

    public SQLGenerator(NameResolver names, PartitionConfigProvider partitions, CompilerSettings settings) {
        this.names = Objects.requireNonNull(names, "names must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(partitions, "partitions must not be null");

        this.validator = new RequestValidator(settings);
        this.aggregationCompiler = new AggregationCompiler(settings);
        this.groupCompiler = new LogicalGroupCompiler(new ConditionCompiler(settings));
        this.pushdownPlanner = new PredicatePushdownPlanner();
        this.joinPlanner = new JoinPlanner(new PartitionPredicateInjector(partitions), groupCompiler);
    }

    public CompilerSettings settings() {
        return settings;
    }

    /**
     * Compiles a request into a paged data query.
     *
     * @param request the request
     * @return the SQL and its bind values
     * @throws ValidationException if the request is malformed
     * @throws SQLGenerationException if the request cannot be expressed in SQL
     */
    public CompiledQuery compile(QueryRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Compilation compilation = build(request, false);
        return finish(request, compilation.statement.toSQL(), compilation.params);
    }

    /**
     * Compiles a request into a query counting its rows (or groups).
     *
     * <p>Ordering and paging are dropped. A grouped request is counted by
     * wrapping it as a subquery; any other request counts directly over the
     * same FROM and WHERE.
     *
     * @param request the request
     * @return the SQL and its bind values
     * @throws ValidationException if the request is malformed
     * @throws SQLGenerationException if the request cannot be expressed in SQL
     */
    public CompiledQuery compileCount(QueryRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Compilation compilation = build(request, true);
        SelectStatement inner = compilation.statement.unordered();

        String sql;
        if (request.isGrouped()) {
            sql = "SELECT " + COUNT_PROJECTION + " FROM (\n" + inner.toSQL() + "\n) sub";
        } else {
            sql = inner.withSelectItems(List.of(COUNT_PROJECTION)).toSQL();
        }
        return finish(request, sql, compilation.params);
    }

    private Compilation build(QueryRequest request, boolean countOnly) {
        try {
            validator.validate(request, countOnly);

            DatasetAliases aliases = DatasetAliases.of(request);
            ColumnResolver columns = new ColumnResolver(aliases, names);
            ColumnTypeResolver types = new ColumnTypeResolver(request.columnMetadata());

            AggregationPlan aggregations = aggregationCompiler.compile(request, columns);
            List<String> groupBy = new ArrayList<>();
            for (String column : request.groupBy()) {
                groupBy.add(columns.qualified(column));
            }

            PushdownPlan pushdown = pushdownPlanner.plan(request, aliases, aggregations::isAggregationAlias);

            ParamGenerator params = new ParamGenerator();
            JoinPlanner.JoinPlan joins = joinPlanner.plan(request, columns, pushdown, types, params);

            Set<String> grouped = new HashSet<>(groupBy);
            CompiledFilter filter = groupCompiler.compile(
                pushdown.remaining(), new QueryScope(columns, aggregations, grouped, types), params);

            SelectStatement statement = new SelectStatement(
                request.highPerformanceHints(),
                selectItems(request, columns, aggregations, countOnly),
                joins.from(),
                joins.joins(),
                filter.where(),
                groupBy,
                request.isGrouped() ? filter.having() : "",
                countOnly ? List.of() : orderBy(request, columns, aggregations, grouped),
                countOnly ? null : new SelectStatement.Paging(request.offset(), request.limit()));

            return new Compilation(statement, params);

        } catch (ValidationException | SQLGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SQLGenerationException("Unexpected error during SQL generation", e, request);
        }
    }

    private static List<String> selectItems(QueryRequest request, ColumnResolver columns,
                                            AggregationPlan aggregations, boolean countOnly) {
        if (!aggregations.isEmpty()) {
            return aggregations.selectItems();
        }
        List<String> items = new ArrayList<>();
        for (String column : request.columns()) {
            String outputName = column.indexOf('.') >= 0 ? column : request.dataset() + "." + column;
            items.add(columns.qualified(column) + " AS " + quoteAlias(outputName));
        }
        if (items.isEmpty() && countOnly) {
            items.add("1");
        }
        return items;
    }

    /**
     * Renders ORDER BY. On a grouped request only grouped columns and
     * aggregation outputs can be sorted on; other sort columns are dropped.
     */
    private static List<String> orderBy(QueryRequest request, ColumnResolver columns,
                                        AggregationPlan aggregations, Set<String> grouped) {
        List<String> items = new ArrayList<>();
        for (SortSpec sort : request.sorting()) {
            String direction = " " + sort.direction().name();
            String alias = aggregations.outputAliasFor(sort.column());
            if (alias != null) {
                items.add(quoteIdentifier(alias) + direction);
                continue;
            }
            String column = columns.qualified(sort.column());
            if (column.isEmpty()) {
                continue;
            }
            if (request.isGrouped() && !grouped.contains(column)) {
                logger.debug("Dropping sort on ungrouped column {}", sort.column());
                continue;
            }
            items.add(column + direction);
        }
        return items;
    }

    private static CompiledQuery finish(QueryRequest request, String sql, ParamGenerator params) {
        if (logger.isDebugEnabled()) {
            logger.debug("Compiled SQL for {}:\n{}", request.dataset(), sql);
            logger.debug("Bind parameters: {}", params.params().keySet());
        }
        return new CompiledQuery(sql, params.params());
    }

    private static final class Compilation {
        final SelectStatement statement;
        final ParamGenerator params;

        Compilation(SelectStatement statement, ParamGenerator params) {
            this.statement = statement;
            this.params = params;
        }
    }
}
