package com.querycraft.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Read-through cache over the table configuration file.
 *
 * <p>The file maps logical dataset names to physical names, column mappings and
 * partition layout:
 * <pre>
 * {
 *   "tables": {
 *     "HR.EMPLOYEES": {
 *       "physical_name": "HR.EMP_MASTER_V2",
 *       "columns": { "NAME": { "physical_name": "FULL_NAME" } },
 *       "partition": {
 *         "load_id_column": "AS_OF_MONTH_SK",
 *         "load_type_column": "LOAD_TYPE",
 *         "supported_types": ["Monthly"]
 *       }
 *     }
 *   }
 * }
 * </pre>
 *
 * <p>Every lookup checks the file's modification time. When it has advanced,
 * the file is parsed into a new immutable snapshot which replaces the old one
 * in a single reference swap, so concurrent readers see either the old or the
 * new configuration, never a mix. A malformed file keeps the previous snapshot.
 */
public class TableConfigCache implements NameResolver, PartitionConfigProvider {

    private static final Logger logger = LoggerFactory.getLogger(TableConfigCache.class);

    private final Path configPath;
    private final ObjectMapper objectMapper;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final Object reloadLock = new Object();

    public TableConfigCache(Path configPath) {
        this(configPath, new ObjectMapper());
    }

    public TableConfigCache(Path configPath, ObjectMapper objectMapper) {
        this.configPath = Objects.requireNonNull(configPath, "configPath must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public String physicalTable(String dataset) {
        TableEntry entry = current().find(dataset);
        if (entry != null && entry.physicalName != null) {
            return entry.physicalName;
        }
        return dataset;
    }

    @Override
    public String physicalColumn(String dataset, String logicalColumn) {
        TableEntry entry = current().find(dataset);
        if (entry != null) {
            String physical = entry.columns.get(logicalColumn.toUpperCase(Locale.ROOT));
            if (physical != null) {
                return physical;
            }
        }
        return logicalColumn;
    }

    @Override
    public Optional<PartitionConfig> lookup(String dataset) {
        TableEntry entry = current().find(dataset);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.partition);
    }

    /**
     * Returns the number of configured tables in the current snapshot.
     *
     * @return the table count
     */
    public int tableCount() {
        return current().tables.size();
    }

    /**
     * Returns the current snapshot, reloading it first if the file changed.
     */
    Snapshot current() {
        Snapshot cached = snapshot.get();
        FileTime modified = modificationTime();

        if (modified == null) {
            if (cached != Snapshot.EMPTY) {
                logger.info("Table configuration {} no longer exists; clearing cached mappings", configPath);
                snapshot.compareAndSet(cached, Snapshot.EMPTY);
            }
            return Snapshot.EMPTY;
        }
        if (cached.modified != null && modified.compareTo(cached.modified) <= 0) {
            return cached;
        }

        synchronized (reloadLock) {
            Snapshot latest = snapshot.get();
            if (latest.modified != null && modified.compareTo(latest.modified) <= 0) {
                return latest;
            }
            try {
                Snapshot loaded = load(modified);
                snapshot.set(loaded);
                logger.info("Loaded table configuration from {} ({} tables)", configPath, loaded.tables.size());
                return loaded;
            } catch (IOException | RuntimeException e) {
                logger.warn("Error loading table configuration from {}: {}", configPath, e.getMessage());
                // keep the last good tables, stamped so this version is not parsed again
                Snapshot stamped = new Snapshot(latest.tables, modified);
                snapshot.set(stamped);
                return stamped;
            }
        }
    }

    private FileTime modificationTime() {
        try {
            return Files.exists(configPath) ? Files.getLastModifiedTime(configPath) : null;
        } catch (IOException e) {
            logger.warn("Cannot stat table configuration {}: {}", configPath, e.getMessage());
            return null;
        }
    }

    private Snapshot load(FileTime modified) throws IOException {
        JsonNode root = objectMapper.readTree(configPath.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Expected a JSON object at the top level");
        }
        Map<String, TableEntry> tables = new HashMap<>();
        JsonNode tablesNode = root.path("tables");
        Iterator<Map.Entry<String, JsonNode>> fields = tablesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            tables.put(field.getKey().toUpperCase(Locale.ROOT), parseTable(field.getValue()));
        }
        return new Snapshot(Collections.unmodifiableMap(tables), modified);
    }

    private static TableEntry parseTable(JsonNode node) {
        String physicalName = upperText(node, "physical_name");

        Map<String, String> columns = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> columnFields = node.path("columns").fields();
        while (columnFields.hasNext()) {
            Map.Entry<String, JsonNode> column = columnFields.next();
            String physicalColumn = upperText(column.getValue(), "physical_name");
            if (physicalColumn != null) {
                columns.put(column.getKey().toUpperCase(Locale.ROOT), physicalColumn);
            }
        }

        PartitionConfig partition = null;
        JsonNode partitionNode = node.get("partition");
        if (partitionNode != null && partitionNode.isObject()) {
            String loadIdColumn = upperText(partitionNode, "load_id_column");
            if (loadIdColumn != null) {
                List<String> supported = new ArrayList<>();
                for (JsonNode type : partitionNode.path("supported_types")) {
                    supported.add(type.asText());
                }
                partition = new PartitionConfig(loadIdColumn, upperText(partitionNode, "load_type_column"), supported);
            }
        }

        return new TableEntry(physicalName, Collections.unmodifiableMap(columns), partition);
    }

    private static String upperText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Immutable parsed view of the configuration file.
     */
    static final class Snapshot {

        static final Snapshot EMPTY = new Snapshot(Map.of(), null);

        final Map<String, TableEntry> tables;
        final FileTime modified;

        Snapshot(Map<String, TableEntry> tables, FileTime modified) {
            this.tables = tables;
            this.modified = modified;
        }

        /**
         * Finds a table by logical name, then by physical name, then by the
         * schema-stripped table name.
         */
        TableEntry find(String dataset) {
            if (dataset == null || tables.isEmpty()) {
                return null;
            }
            String key = dataset.trim().toUpperCase(Locale.ROOT);

            TableEntry exact = tables.get(key);
            if (exact != null) {
                return exact;
            }

            for (TableEntry entry : tables.values()) {
                if (key.equals(entry.physicalName)) {
                    return entry;
                }
            }

            int dot = key.indexOf('.');
            if (dot >= 0) {
                String tableOnly = key.substring(dot + 1);
                for (Map.Entry<String, TableEntry> entry : tables.entrySet()) {
                    if (entry.getKey().equals(tableOnly) || entry.getKey().endsWith("." + tableOnly)) {
                        return entry.getValue();
                    }
                }
            }
            return null;
        }
    }

    static final class TableEntry {
        final String physicalName;
        final Map<String, String> columns;
        final PartitionConfig partition;

        TableEntry(String physicalName, Map<String, String> columns, PartitionConfig partition) {
            this.physicalName = physicalName;
            this.columns = columns;
            this.partition = partition;
        }
    }
}
