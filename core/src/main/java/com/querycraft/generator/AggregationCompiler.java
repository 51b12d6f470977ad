package com.querycraft.generator;

import com.querycraft.config.CompilerSettings;
import com.querycraft.request.AggregationSpec;
import com.querycraft.request.QueryRequest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.querycraft.generator.SQLQuoting.quoteAlias;
import static com.querycraft.generator.SQLQuoting.quoteIdentifier;
import static com.querycraft.generator.SQLQuoting.sanitizeAlias;

/**
 * Builds the SELECT list of an aggregating request.
 *
 * <p>Grouped columns come first, each aliased with the name the user grouped
 * by. Each aggregation follows as {@code FUNC(col) AS "ALIAS"}, where the alias
 * is the requested output name (or {@code FUNCTION_column}) sanitized to
 * {@code [A-Za-z0-9_]} and truncated. Colliding aliases get {@code _1},
 * {@code _2}, ... in the order they appear:
 * <pre>
 *   sum(AMOUNT) as "Total"   -&gt;  SUM("SALES"."AMOUNT") AS "TOTAL"
 *   avg(AMOUNT) as "Total"   -&gt;  AVG("SALES"."AMOUNT") AS "TOTAL_1"
 * </pre>
 */
public class AggregationCompiler {

    private final CompilerSettings settings;

    public AggregationCompiler(CompilerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Compiles the aggregations of a request.
     *
     * @param request the request
     * @param columns resolves column references of the request
     * @return the plan, or {@link AggregationPlan#NONE} if the request does not aggregate
     */
    public AggregationPlan compile(QueryRequest request, ColumnResolver columns) {
        if (!request.hasAggregations()) {
            return AggregationPlan.NONE;
        }

        List<String> selectItems = new ArrayList<>();
        for (String groupColumn : request.groupBy()) {
            selectItems.add(columns.qualified(groupColumn) + " AS " + quoteAlias(groupColumn));
        }

        List<String> outputAliases = new ArrayList<>();
        Map<String, String> expressions = new HashMap<>();
        Map<String, String> aliasesByName = new HashMap<>();
        Set<String> used = new HashSet<>();

        for (AggregationSpec aggregation : request.aggregations()) {
            String expression = aggregation.function().apply(columns.qualified(aggregation.sourceColumn()));
            String requested = aggregation.requestedAlias();
            String base = sanitizeAlias(requested, settings.maxAliasLength(), settings.fallbackAlias());
            String alias = uniqueAlias(base, used, settings.maxAliasLength());

            selectItems.add(expression + " AS " + quoteIdentifier(alias));
            outputAliases.add(alias);

            // First definition wins when two aggregations asked for the same name
            expressions.putIfAbsent(AggregationPlan.key(requested), expression);
            aliasesByName.putIfAbsent(AggregationPlan.key(requested), alias);
            expressions.put(AggregationPlan.key(alias), expression);
            aliasesByName.put(AggregationPlan.key(alias), alias);
        }

        return new AggregationPlan(selectItems, outputAliases, expressions, aliasesByName);
    }

    /**
     * Appends {@code _1}, {@code _2}, ... until the alias is unused. The base is
     * shortened so that base and suffix stay within {@code maxLength}.
     */
    private static String uniqueAlias(String base, Set<String> used, int maxLength) {
        String candidate = base;
        int suffix = 1;
        while (!used.add(AggregationPlan.key(candidate))) {
            String tail = "_" + suffix;
            int keep = Math.max(0, Math.min(base.length(), maxLength - tail.length()));
            candidate = base.substring(0, keep) + tail;
            suffix++;
        }
        return candidate;
    }
}
