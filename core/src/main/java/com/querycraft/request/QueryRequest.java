package com.querycraft.request;

import com.querycraft.filter.LogicalGroup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A tabular query to compile: projection, joins, nested filters, grouping,
 * aggregation, sorting, partition restriction and paging.
 *
 * <p>Requests are built fresh for every compilation and are immutable.
 *
 * <p>Example:
 * <pre>
 *   QueryRequest request = QueryRequest.builder("EMP")
 *       .columns("ID", "NAME")
 *       .filters(LogicalGroup.and(nameContainsJo))
 *       .sorting(SortSpec.asc("NAME"))
 *       .limit(50)
 *       .build();
 * </pre>
 */
public final class QueryRequest {

    public static final int DEFAULT_LIMIT = 100;

    private final String dataset;
    private final List<String> columns;
    private final List<JoinSpec> joins;
    private final LogicalGroup filters;
    private final List<String> groupBy;
    private final List<AggregationSpec> aggregations;
    private final List<SortSpec> sorting;
    private final Map<String, ColumnMetadata> columnMetadata;
    private final Map<String, List<Object>> partitionFilters;
    private final String partitionLoadType;
    private final int limit;
    private final int offset;
    private final boolean highPerformanceHints;

    private QueryRequest(Builder builder) {
        this.dataset = Objects.requireNonNull(builder.dataset, "dataset must not be null");
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.joins = Collections.unmodifiableList(new ArrayList<>(builder.joins));
        this.filters = builder.filters;
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(builder.groupBy));
        this.aggregations = Collections.unmodifiableList(new ArrayList<>(builder.aggregations));
        this.sorting = Collections.unmodifiableList(new ArrayList<>(builder.sorting));
        this.columnMetadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.columnMetadata));
        Map<String, List<Object>> partitions = new LinkedHashMap<>();
        builder.partitionFilters.forEach((ds, values) ->
            partitions.put(ds, Collections.unmodifiableList(new ArrayList<>(values))));
        this.partitionFilters = Collections.unmodifiableMap(partitions);
        this.partitionLoadType = builder.partitionLoadType;
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.highPerformanceHints = builder.highPerformanceHints;
    }

    public static Builder builder(String dataset) {
        return new Builder(dataset);
    }

    public String dataset() {
        return dataset;
    }

    public List<String> columns() {
        return columns;
    }

    public List<JoinSpec> joins() {
        return joins;
    }

    /**
     * Returns the filter tree.
     *
     * @return the root group, or null if the request is unfiltered
     */
    public LogicalGroup filters() {
        return filters;
    }

    public List<String> groupBy() {
        return groupBy;
    }

    public List<AggregationSpec> aggregations() {
        return aggregations;
    }

    public List<SortSpec> sorting() {
        return sorting;
    }

    public Map<String, ColumnMetadata> columnMetadata() {
        return columnMetadata;
    }

    public Map<String, List<Object>> partitionFilters() {
        return partitionFilters;
    }

    /**
     * Returns the selected partition values for a dataset (case-insensitive key match).
     *
     * @param datasetName the dataset
     * @return the values, or an empty list if the dataset is not restricted
     */
    public List<Object> partitionValuesFor(String datasetName) {
        List<Object> exact = partitionFilters.get(datasetName);
        if (exact != null) {
            return exact;
        }
        String key = datasetName.toUpperCase(Locale.ROOT);
        for (Map.Entry<String, List<Object>> entry : partitionFilters.entrySet()) {
            if (entry.getKey().toUpperCase(Locale.ROOT).equals(key)) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    public String partitionLoadType() {
        return partitionLoadType;
    }

    public int limit() {
        return limit;
    }

    public int offset() {
        return offset;
    }

    public boolean highPerformanceHints() {
        return highPerformanceHints;
    }

    public boolean hasAggregations() {
        return !aggregations.isEmpty();
    }

    public boolean isGrouped() {
        return !groupBy.isEmpty() || !aggregations.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("QueryRequest(dataset=%s, columns=%s, joins=%d, groupBy=%s, aggregations=%d, limit=%d, offset=%d)",
            dataset, columns, joins.size(), groupBy, aggregations.size(), limit, offset);
    }

    /**
     * Builder for {@link QueryRequest}.
     */
    public static final class Builder {

        private final String dataset;
        private final List<String> columns = new ArrayList<>();
        private final List<JoinSpec> joins = new ArrayList<>();
        private LogicalGroup filters;
        private final List<String> groupBy = new ArrayList<>();
        private final List<AggregationSpec> aggregations = new ArrayList<>();
        private final List<SortSpec> sorting = new ArrayList<>();
        private final Map<String, ColumnMetadata> columnMetadata = new LinkedHashMap<>();
        private final Map<String, List<Object>> partitionFilters = new LinkedHashMap<>();
        private String partitionLoadType;
        private int limit = DEFAULT_LIMIT;
        private int offset = 0;
        private boolean highPerformanceHints;

        private Builder(String dataset) {
            this.dataset = dataset;
        }

        public Builder columns(String... names) {
            return columns(List.of(names));
        }

        public Builder columns(List<String> names) {
            columns.addAll(names);
            return this;
        }

        public Builder join(JoinSpec join) {
            joins.add(join);
            return this;
        }

        public Builder joins(List<JoinSpec> specs) {
            joins.addAll(specs);
            return this;
        }

        public Builder filters(LogicalGroup group) {
            this.filters = group;
            return this;
        }

        public Builder groupBy(String... names) {
            return groupBy(List.of(names));
        }

        public Builder groupBy(List<String> names) {
            groupBy.addAll(names);
            return this;
        }

        public Builder aggregation(AggregationSpec spec) {
            aggregations.add(spec);
            return this;
        }

        public Builder aggregations(List<AggregationSpec> specs) {
            aggregations.addAll(specs);
            return this;
        }

        public Builder sorting(SortSpec... specs) {
            return sorting(List.of(specs));
        }

        public Builder sorting(List<SortSpec> specs) {
            sorting.addAll(specs);
            return this;
        }

        public Builder columnMetadata(String column, ColumnMetadata metadata) {
            columnMetadata.put(column, metadata);
            return this;
        }

        public Builder columnMetadata(Map<String, ColumnMetadata> metadata) {
            columnMetadata.putAll(metadata);
            return this;
        }

        public Builder partitionFilter(String datasetName, List<?> values) {
            partitionFilters.put(datasetName, new ArrayList<>(values));
            return this;
        }

        public Builder partitionLoadType(String loadType) {
            this.partitionLoadType = loadType;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder highPerformanceHints(boolean enabled) {
            this.highPerformanceHints = enabled;
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(this);
        }
    }
}
