package com.querycraft.config;

import java.util.Optional;

/**
 * Looks up the partition layout of a dataset.
 *
 * <p>Lookups are case-insensitive; implementations fall back to the
 * schema-stripped table name when the qualified name is not configured.
 */
public interface PartitionConfigProvider {

    /** Provider for deployments without partitioned datasets. */
    PartitionConfigProvider NONE = dataset -> Optional.empty();

    /**
     * Returns the partition configuration for a dataset.
     *
     * @param dataset the logical dataset name, e.g. "HR.EMPLOYEES"
     * @return the configuration, or empty if the dataset is not partitioned
     */
    Optional<PartitionConfig> lookup(String dataset);
}
