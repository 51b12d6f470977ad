package com.querycraft.planner;

import com.querycraft.request.JoinSpec;
import com.querycraft.request.QueryRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Assigns a unique alias to every dataset occurrence of a request.
 *
 * <p>The base dataset is occurrence 0 and the right side of join {@code i} is
 * occurrence {@code i + 1}. Aliases flatten {@code schema.table} to
 * {@code schema_table}; a dataset that occurs again gets {@code _1}, {@code _2},
 * ... appended, which is what lets a dataset be joined to itself. A suffix
 * already taken by another dataset's alias is skipped:
 * <pre>
 *   ORDERS JOIN ORDERS             -&gt;  aliases ORDERS, ORDERS_1
 *   ORDERS JOIN ORDERS_1 JOIN ORDERS  -&gt;  aliases ORDERS, ORDERS_1, ORDERS_2
 * </pre>
 *
 * <p>Column references are resolved against the occurrences:
 * <ul>
 *   <li>{@code COL} - the base dataset</li>
 *   <li>{@code DATASET.COL} or {@code SCHEMA.TABLE.COL} - the first occurrence of that dataset</li>
 *   <li>{@code TABLE.COL} - the first dataset whose name ends with {@code .TABLE}</li>
 *   <li>{@code ORDERS_1.COL} - the occurrence with that generated alias</li>
 * </ul>
 */
public final class DatasetAliases {

    private final List<Occurrence> occurrences;

    private DatasetAliases(List<Occurrence> occurrences) {
        this.occurrences = Collections.unmodifiableList(occurrences);
    }

    /**
     * One appearance of a dataset in the FROM/JOIN chain.
     *
     * @param index 0 for the base dataset, {@code i + 1} for the right side of join {@code i}
     * @param dataset the logical dataset name
     * @param alias the unique alias
     */
    public record Occurrence(int index, String dataset, String alias) {

        public boolean isBase() {
            return index == 0;
        }

        @Override
        public String toString() {
            return dataset + " AS " + alias;
        }
    }

    /**
     * A column reference split into its dataset occurrence and column name.
     *
     * @param occurrence the occurrence, or null if the qualifier matched no dataset
     * @param qualifier the qualifier as written (null for an unqualified reference)
     * @param column the bare column name
     */
    public record ColumnReference(Occurrence occurrence, String qualifier, String column) {

        public boolean isResolved() {
            return occurrence != null;
        }
    }

    public static DatasetAliases of(QueryRequest request) {
        Map<String, Integer> seen = new HashMap<>();
        Set<String> issued = new HashSet<>();
        List<Occurrence> occurrences = new ArrayList<>();
        occurrences.add(new Occurrence(0, request.dataset(), nextAlias(request.dataset(), seen, issued)));
        int index = 1;
        for (JoinSpec join : request.joins()) {
            occurrences.add(new Occurrence(index++, join.rightDataset(), nextAlias(join.rightDataset(), seen, issued)));
        }
        return new DatasetAliases(occurrences);
    }

    private static String nextAlias(String dataset, Map<String, Integer> seen, Set<String> issued) {
        String flat = dataset.replace('.', '_');
        String key = flat.toUpperCase(Locale.ROOT);
        int count = seen.getOrDefault(key, 0);
        String alias = count == 0 ? flat : flat + "_" + count;
        // aliases are compared the way the database compares quoted upper-case names
        while (!issued.add(alias.toUpperCase(Locale.ROOT))) {
            count++;
            alias = flat + "_" + count;
        }
        seen.put(key, count + 1);
        return alias;
    }

    public Occurrence base() {
        return occurrences.get(0);
    }

    public List<Occurrence> all() {
        return occurrences;
    }

    /**
     * Returns the occurrence introduced by a join.
     *
     * @param joinIndex the index of the join in the request
     * @return the right-side occurrence
     */
    public Occurrence forJoin(int joinIndex) {
        return occurrences.get(joinIndex + 1);
    }

    /**
     * Resolves a dataset qualifier against every occurrence.
     *
     * @param qualifier a dataset name, a table name without schema, or a generated alias
     * @return the occurrence, or null if nothing matches
     */
    public Occurrence resolveQualifier(String qualifier) {
        return resolveQualifier(qualifier, occurrence -> true);
    }

    /**
     * Resolves a dataset qualifier against the occurrences accepted by a filter.
     *
     * <p>Dataset names win over generated aliases, then schema-less table names
     * are tried. Matching is case-insensitive; the first matching occurrence wins.
     *
     * @param qualifier the qualifier
     * @param candidates which occurrences may match
     * @return the occurrence, or null if nothing matches
     */
    public Occurrence resolveQualifier(String qualifier, Predicate<Occurrence> candidates) {
        if (qualifier == null || qualifier.isBlank()) {
            return null;
        }
        String wanted = qualifier.trim().toUpperCase(Locale.ROOT);
        for (Occurrence occurrence : occurrences) {
            if (candidates.test(occurrence) && occurrence.dataset().toUpperCase(Locale.ROOT).equals(wanted)) {
                return occurrence;
            }
        }
        for (Occurrence occurrence : occurrences) {
            if (candidates.test(occurrence) && occurrence.alias().toUpperCase(Locale.ROOT).equals(wanted)) {
                return occurrence;
            }
        }
        for (Occurrence occurrence : occurrences) {
            if (candidates.test(occurrence) && occurrence.dataset().toUpperCase(Locale.ROOT).endsWith("." + wanted)) {
                return occurrence;
            }
        }
        return null;
    }

    /**
     * Resolves a column reference.
     *
     * @param columnRef the reference, e.g. "AMOUNT", "ORDERS.AMOUNT" or "SALES.ORDERS.AMOUNT"
     * @return the resolved reference, or null if the reference is blank
     */
    public ColumnReference resolve(String columnRef) {
        Objects.requireNonNull(columnRef, "columnRef must not be null");
        String ref = columnRef.trim();
        if (ref.isEmpty()) {
            return null;
        }
        int dot = ref.lastIndexOf('.');
        if (dot < 0) {
            return new ColumnReference(base(), null, ref);
        }
        String qualifier = ref.substring(0, dot);
        String column = ref.substring(dot + 1);
        if (column.isBlank()) {
            return null;
        }
        return new ColumnReference(resolveQualifier(qualifier), qualifier, column);
    }

    @Override
    public String toString() {
        return occurrences.toString();
    }
}
