package com.querycraft.config;

/**
 * Maps logical dataset and column names to the physical names in the database.
 *
 * <p>Both lookups are case-insensitive and return the input unchanged when no
 * mapping is configured.
 */
public interface NameResolver {

    /** Resolver that keeps every name as given. */
    NameResolver IDENTITY = new NameResolver() {
        @Override
        public String physicalTable(String dataset) {
            return dataset;
        }

        @Override
        public String physicalColumn(String dataset, String logicalColumn) {
            return logicalColumn;
        }
    };

    String physicalTable(String dataset);

    String physicalColumn(String dataset, String logicalColumn);
}
