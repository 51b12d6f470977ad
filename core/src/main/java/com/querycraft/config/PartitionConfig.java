package com.querycraft.config;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Partition layout of one dataset.
 *
 * @param loadIdColumn the column holding the load/vintage id (e.g. AS_OF_MONTH_SK)
 * @param loadTypeColumn the column holding the load type (may be null)
 * @param supportedTypes load types the dataset is published with; empty means any
 */
public record PartitionConfig(String loadIdColumn, String loadTypeColumn, List<String> supportedTypes) {

    public PartitionConfig {
        Objects.requireNonNull(loadIdColumn, "loadIdColumn must not be null");
        supportedTypes = supportedTypes == null ? List.of() : List.copyOf(supportedTypes);
    }

    public PartitionConfig(String loadIdColumn) {
        this(loadIdColumn, null, List.of());
    }

    public boolean hasLoadTypeColumn() {
        return loadTypeColumn != null && !loadTypeColumn.isBlank();
    }

    /**
     * Returns whether a load type may be filtered on for this dataset.
     *
     * @param loadType the selected load type
     * @return true if there is a load-type column and the type is supported
     */
    public boolean supportsLoadType(String loadType) {
        if (!hasLoadTypeColumn() || loadType == null || loadType.isBlank()) {
            return false;
        }
        if (supportedTypes.isEmpty()) {
            return true;
        }
        String wanted = loadType.trim().toUpperCase(Locale.ROOT);
        for (String type : supportedTypes) {
            if (type.toUpperCase(Locale.ROOT).equals(wanted)) {
                return true;
            }
        }
        return false;
    }
}
