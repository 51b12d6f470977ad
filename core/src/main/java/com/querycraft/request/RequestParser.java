package com.querycraft.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querycraft.exception.ValidationException;
import com.querycraft.filter.ColumnDataType;
import com.querycraft.filter.FilterCondition;
import com.querycraft.filter.FilterNode;
import com.querycraft.filter.FilterOperator;
import com.querycraft.filter.LogicalGroup;
import com.querycraft.request.JoinSpec.JoinKey;
import com.querycraft.request.JoinSpec.JoinType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads a JSON query payload into a {@link QueryRequest}.
 *
 * <p>The payload uses snake_case keys:
 * <pre>
 * {
 *   "dataset": "EMP",
 *   "columns": ["ID", "NAME"],
 *   "joins": [{"left_dataset": "EMP", "right_dataset": "DEPT", "join_type": "left",
 *              "on": [{"left_column": "DEPT_ID", "right_column": "ID"}]}],
 *   "filters": {"logic": "AND", "conditions": [
 *       {"column": "NAME", "datatype": "string", "operator": "contains", "value": "Jo"}]},
 *   "group_by": [], "aggregations": [{"column": "SALARY", "function": "sum", "output_name": "Total"}],
 *   "sorting": [{"column": "NAME", "direction": "DESC"}],
 *   "column_metadata": {"HIRED": {"data_type": "DATE", "base_type": "date"}},
 *   "partition_filters": {"EMP": [202601]}, "partition_load_type": "Monthly",
 *   "limit": 100, "offset": 0
 * }
 * </pre>
 *
 * <p>Filter nodes are told apart by shape: a node with a {@code column} key is a
 * condition, a node with {@code logic} or {@code conditions} is a group.
 */
public class RequestParser {

    private static final Logger logger = LoggerFactory.getLogger(RequestParser.class);

    private final ObjectMapper objectMapper;

    public RequestParser() {
        this(new ObjectMapper());
    }

    public RequestParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a JSON payload.
     *
     * @param json the payload text
     * @return the request
     * @throws ValidationException if the payload is not valid JSON or has an invalid shape
     */
    public QueryRequest parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException(
                "Request body is not valid JSON: " + e.getOriginalMessage(),
                "payload parsing",
                abbreviate(json),
                "Send a JSON object describing the query");
        }
        return parse(root);
    }

    /**
     * Converts an already-parsed JSON tree.
     *
     * @param root the payload root object
     * @return the request
     * @throws ValidationException if the payload has an invalid shape
     */
    public QueryRequest parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ValidationException(
                "Request body must be a JSON object", "payload parsing", String.valueOf(root));
        }

        String dataset = requiredText(root, "dataset");
        QueryRequest.Builder builder = QueryRequest.builder(dataset);

        builder.columns(textList(root.get("columns")));
        builder.groupBy(textList(root.get("group_by")));

        for (JsonNode join : elements(root.get("joins"))) {
            builder.join(convertJoin(join));
        }

        JsonNode filters = root.get("filters");
        if (filters != null && !filters.isNull()) {
            FilterNode node = convertFilterNode(filters);
            builder.filters(node instanceof LogicalGroup group
                ? group
                : new LogicalGroup(LogicalGroup.Logic.AND, List.of(node)));
        }

        for (JsonNode agg : elements(root.get("aggregations"))) {
            builder.aggregation(new AggregationSpec(
                requiredText(agg, "column"),
                AggregationSpec.Function.fromToken(text(agg, "function")),
                text(agg, "output_name")));
        }

        for (JsonNode sort : elements(root.get("sorting"))) {
            builder.sorting(new SortSpec(
                requiredText(sort, "column"),
                SortSpec.Direction.fromToken(text(sort, "direction"))));
        }

        JsonNode metadata = root.get("column_metadata");
        if (metadata != null && metadata.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = metadata.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode meta = field.getValue();
                if (meta.isObject()) {
                    builder.columnMetadata(field.getKey(),
                        new ColumnMetadata(text(meta, "data_type"), text(meta, "base_type")));
                } else if (meta.isTextual()) {
                    builder.columnMetadata(field.getKey(), new ColumnMetadata(null, meta.asText()));
                }
            }
        }

        JsonNode partitions = root.get("partition_filters");
        if (partitions != null && partitions.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = partitions.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                List<Object> values = new ArrayList<>();
                for (JsonNode v : elements(field.getValue())) {
                    values.add(toJava(v));
                }
                builder.partitionFilter(field.getKey(), values);
            }
        }

        builder.partitionLoadType(text(root, "partition_load_type"));
        builder.limit(root.path("limit").asInt(QueryRequest.DEFAULT_LIMIT));
        builder.offset(root.path("offset").asInt(0));
        builder.highPerformanceHints(root.path("use_high_perf_hints")
            .asBoolean(root.path("high_performance_hints").asBoolean(false)));

        QueryRequest request = builder.build();
        logger.debug("Parsed request: {}", request);
        return request;
    }

    private JoinSpec convertJoin(JsonNode join) {
        List<JoinKey> keys = new ArrayList<>();
        for (JsonNode on : elements(join.get("on"))) {
            keys.add(new JoinKey(requiredText(on, "left_column"), requiredText(on, "right_column")));
        }
        return new JoinSpec(
            requiredText(join, "left_dataset"),
            requiredText(join, "right_dataset"),
            JoinType.fromToken(text(join, "join_type")),
            keys);
    }

    private FilterNode convertFilterNode(JsonNode node) {
        if (node.isObject() && node.has("column")) {
            FilterOperator operator = FilterOperator.fromToken(text(node, "operator"));
            return FilterCondition.of(
                text(node, "column"),
                ColumnDataType.fromToken(text(node, "datatype")),
                operator,
                toJava(node.get("value")));
        }
        if (node.isObject() && (node.has("logic") || node.has("conditions"))) {
            List<FilterNode> children = new ArrayList<>();
            for (JsonNode child : elements(node.get("conditions"))) {
                children.add(convertFilterNode(child));
            }
            return new LogicalGroup(LogicalGroup.Logic.fromToken(text(node, "logic")), children);
        }
        throw new ValidationException(
            "Invalid item in filter group: expected a condition or a nested group",
            "filter validation",
            node.toString(),
            "Conditions need a 'column'; groups need 'logic' and 'conditions'");
    }

    /**
     * Converts a JSON value to the plain Java value bound as a parameter.
     */
    static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isInt()) {
            return node.intValue();
        }
        if (node.isLong()) {
            return node.longValue();
        }
        if (node.isBigInteger()) {
            return node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            for (JsonNode element : node) {
                values.add(toJava(element));
            }
            return values;
        }
        throw new ValidationException(
            "Unsupported filter value: " + node, "filter validation", node.toString(),
            "Use a string, number, boolean or list");
    }

    private static Iterable<JsonNode> elements(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ValidationException(
                "Expected a JSON array", "payload parsing", node.toString());
        }
        return node;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : elements(node)) {
            values.add(element.asText());
        }
        return values;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String requiredText(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new ValidationException(
                "Missing required field '" + field + "'",
                "payload parsing",
                node.toString(),
                "Provide a non-empty '" + field + "'");
        }
        return value;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
