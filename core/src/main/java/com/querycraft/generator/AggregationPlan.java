package com.querycraft.generator;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The SELECT items of an aggregating request and the output aliases they define.
 *
 * <p>Aggregation outputs can be referenced by filters and sorts under either
 * the alias the user asked for or the sanitized alias actually emitted;
 * lookups ignore case.
 */
public final class AggregationPlan {

    public static final AggregationPlan NONE = new AggregationPlan(List.of(), List.of(), Map.of(), Map.of());

    private final List<String> selectItems;
    private final List<String> outputAliases;
    private final Map<String, String> expressionsByName;
    private final Map<String, String> outputAliasesByName;

    AggregationPlan(List<String> selectItems, List<String> outputAliases,
                    Map<String, String> expressionsByName, Map<String, String> outputAliasesByName) {
        this.selectItems = Collections.unmodifiableList(selectItems);
        this.outputAliases = Collections.unmodifiableList(outputAliases);
        this.expressionsByName = Collections.unmodifiableMap(expressionsByName);
        this.outputAliasesByName = Collections.unmodifiableMap(outputAliasesByName);
    }

    /**
     * Returns the SELECT items: grouped columns first, then the aggregates.
     *
     * @return the items
     */
    public List<String> selectItems() {
        return selectItems;
    }

    public boolean isEmpty() {
        return outputAliases.isEmpty();
    }

    public boolean isAggregationAlias(String name) {
        return name != null && expressionsByName.containsKey(key(name));
    }

    /**
     * Returns the aggregate expression behind an output alias.
     *
     * @param name the requested or emitted alias
     * @return e.g. {@code SUM("SALES"."AMOUNT")}, or null if the name is not an aggregation
     */
    public String expressionFor(String name) {
        return name == null ? null : expressionsByName.get(key(name));
    }

    /**
     * Returns the emitted (sanitized, de-duplicated) alias for a name.
     *
     * @param name the requested or emitted alias
     * @return the emitted alias, or null if the name is not an aggregation
     */
    public String outputAliasFor(String name) {
        return name == null ? null : outputAliasesByName.get(key(name));
    }

    /**
     * Returns every emitted alias.
     *
     * @return the aliases in SELECT order
     */
    public List<String> outputAliases() {
        return outputAliases;
    }

    static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
