package com.querycraft.types;

import com.querycraft.filter.ColumnDataType;

import java.util.Objects;

/**
 * The effective type of a filtered column after column metadata is consulted.
 *
 * @param dataType the datatype comparisons are compiled for
 * @param text whether the column holds text (drives case-insensitive matching
 *             and the empty-string checks)
 */
public record ResolvedColumnType(ColumnDataType dataType, boolean text) {

    public ResolvedColumnType {
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public boolean isTemporal() {
        return dataType.isTemporal();
    }

    public boolean isNumeric() {
        return dataType == ColumnDataType.NUMBER;
    }

    /**
     * Returns the resolved type for a datatype with no metadata override.
     *
     * @param dataType the declared datatype
     * @return the resolved type
     */
    public static ResolvedColumnType of(ColumnDataType dataType) {
        return new ResolvedColumnType(dataType, dataType == ColumnDataType.STRING);
    }
}
