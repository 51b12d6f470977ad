package com.querycraft.types;

import com.querycraft.filter.ColumnDataType;
import com.querycraft.filter.FilterCondition;
import com.querycraft.request.ColumnMetadata;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the effective type of a filtered column.
 *
 * <p>Filter UIs tag every condition with a datatype, but often default to
 * "string" when the user never picked one. When a condition is tagged as a
 * string and the request carries column metadata for that column, the
 * database type name decides instead:
 * <ul>
 *   <li>TIMESTAMP... - timestamp</li>
 *   <li>any name containing DATE, TIME or STAMP - date</li>
 *   <li>any name containing NUMBER, NUMERIC, FLOAT, INT or DECIMAL - number</li>
 * </ul>
 *
 * <p>Metadata keys are matched case-insensitively, first on the full column
 * reference and then on the bare column name.
 */
public class ColumnTypeResolver {

    private static final String[] TEMPORAL_MARKERS = {"date", "time", "stamp"};
    private static final String[] NUMERIC_MARKERS = {"numeric", "number", "float", "int", "decimal"};

    private final Map<String, ColumnMetadata> metadata;

    public ColumnTypeResolver(Map<String, ColumnMetadata> metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
    }

    /**
     * Resolves the type a condition is compiled for.
     *
     * @param condition the condition
     * @return the resolved type
     */
    public ResolvedColumnType resolve(FilterCondition condition) {
        ColumnDataType declared = condition.dataType();
        ColumnMetadata meta = find(condition.column());
        if (meta == null) {
            return ResolvedColumnType.of(declared);
        }

        ColumnDataType effective = declared;
        if (declared == ColumnDataType.STRING) {
            effective = inferFrom(meta.typeDescription(), declared);
        }
        boolean text = effective == ColumnDataType.STRING || isTextBaseType(meta.normalizedBaseType());
        return new ResolvedColumnType(effective, text);
    }

    /**
     * Finds the metadata entry for a column reference.
     *
     * @param column the column reference, optionally qualified
     * @return the metadata, or null if none matches
     */
    public ColumnMetadata find(String column) {
        if (column == null || column.isBlank() || metadata.isEmpty()) {
            return null;
        }
        ColumnMetadata exact = metadata.get(column);
        if (exact != null) {
            return exact;
        }
        String upper = column.toUpperCase(Locale.ROOT);
        String bare = lastPart(upper);
        for (Map.Entry<String, ColumnMetadata> entry : metadata.entrySet()) {
            String key = entry.getKey().toUpperCase(Locale.ROOT);
            if (key.equals(upper) || lastPart(key).equals(bare)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Returns the normalized base type of a dataset column, looked up as
     * {@code DATASET.COLUMN} or the bare column name.
     *
     * @param dataset the dataset
     * @param column the bare column name
     * @return the lower-cased base type, or an empty string if unknown
     */
    public String baseTypeOf(String dataset, String column) {
        String qualified = (dataset + "." + column).toUpperCase(Locale.ROOT);
        String bare = column.toUpperCase(Locale.ROOT);
        for (Map.Entry<String, ColumnMetadata> entry : metadata.entrySet()) {
            String key = entry.getKey().toUpperCase(Locale.ROOT);
            if (key.equals(qualified) || key.equals(bare)) {
                return entry.getValue().normalizedBaseType();
            }
        }
        return "";
    }

    static ColumnDataType inferFrom(String typeDescription, ColumnDataType fallback) {
        if (typeDescription.contains("timestamp")) {
            return ColumnDataType.TIMESTAMP;
        }
        if (containsAny(typeDescription, TEMPORAL_MARKERS)) {
            return ColumnDataType.DATE;
        }
        if (containsAny(typeDescription, NUMERIC_MARKERS)) {
            return ColumnDataType.NUMBER;
        }
        return fallback;
    }

    private static boolean isTextBaseType(String baseType) {
        return baseType.equals("text") || baseType.equals("string") || baseType.equals("varchar");
    }

    private static boolean containsAny(String value, String[] markers) {
        for (String marker : markers) {
            if (value.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static String lastPart(String name) {
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }
}
