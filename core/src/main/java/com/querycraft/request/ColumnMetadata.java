package com.querycraft.request;

import java.util.Locale;

/**
 * Optional type hints for a column, supplied alongside a request by the caller
 * (typically from a schema browse done earlier).
 *
 * @param dataType the database type name, e.g. "NUMBER(10,2)" or "TIMESTAMP(6)" (may be null)
 * @param baseType the simplified type family, e.g. "text", "number", "date" (may be null)
 */
public record ColumnMetadata(String dataType, String baseType) {

    /**
     * Returns the most specific type description available, lower-cased.
     *
     * @return the data type, else the base type, else an empty string
     */
    public String typeDescription() {
        String type = dataType != null && !dataType.isBlank() ? dataType : baseType;
        return type == null ? "" : type.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the lower-cased base type.
     *
     * @return the base type, or an empty string
     */
    public String normalizedBaseType() {
        return baseType == null ? "" : baseType.trim().toLowerCase(Locale.ROOT);
    }
}
