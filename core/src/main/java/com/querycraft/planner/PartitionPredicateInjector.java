package com.querycraft.planner;

import com.querycraft.config.PartitionConfig;
import com.querycraft.config.PartitionConfigProvider;
import com.querycraft.generator.ParamGenerator;
import com.querycraft.request.QueryRequest;
import com.querycraft.types.ColumnTypeResolver;
import com.querycraft.types.ValueCoercion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import static com.querycraft.generator.SQLQuoting.parameterToken;
import static com.querycraft.generator.SQLQuoting.quoteIdentifier;

/**
 * Restricts a dataset to the partitions (loads) selected in the request.
 *
 * <p>For a dataset listed in the request's partition filters and configured
 * with a load-id column:
 * <pre>
 *   one value       "AS_OF_MONTH_SK" = :part_EMP_1
 *   several values  "AS_OF_MONTH_SK" IN (:part_EMP_1, :part_EMP_2)
 *   load type       UPPER("LOAD_TYPE") = :lt_EMP_3
 * </pre>
 * Values are coerced by the load-id column's base type from the request's
 * column metadata. The load-type predicate is added only when the dataset has
 * a load-type column that supports the selected type.
 */
public class PartitionPredicateInjector {

    private static final Logger logger = LoggerFactory.getLogger(PartitionPredicateInjector.class);

    private final PartitionConfigProvider partitions;

    public PartitionPredicateInjector(PartitionConfigProvider partitions) {
        this.partitions = Objects.requireNonNull(partitions, "partitions must not be null");
    }

    /**
     * Builds the partition predicates for one dataset.
     *
     * @param dataset the logical dataset
     * @param request the request holding the selected partitions
     * @param types resolves the base type of the load-id column
     * @param params the parameter generator of this compilation
     * @return the predicates to AND together, empty if the dataset is not restricted
     */
    public List<String> predicatesFor(String dataset, QueryRequest request, ColumnTypeResolver types,
                                      ParamGenerator params) {
        List<Object> values = request.partitionValuesFor(dataset);
        if (values.isEmpty()) {
            return List.of();
        }
        Optional<PartitionConfig> lookup = partitions.lookup(dataset);
        if (lookup.isEmpty()) {
            logger.debug("No partition configuration for {}; ignoring partition filter", dataset);
            return List.of();
        }

        PartitionConfig config = lookup.get();
        String token = parameterToken(dataset);
        String baseType = types.baseTypeOf(dataset, config.loadIdColumn());
        String loadIdColumn = quoteIdentifier(config.loadIdColumn());

        List<String> predicates = new ArrayList<>();
        if (values.size() == 1) {
            String placeholder = params.add("part_" + token, ValueCoercion.coercePartitionValue(values.get(0), baseType));
            predicates.add(loadIdColumn + " = " + placeholder);
        } else {
            List<String> placeholders = new ArrayList<>(values.size());
            for (Object value : values) {
                placeholders.add(params.add("part_" + token, ValueCoercion.coercePartitionValue(value, baseType)));
            }
            predicates.add(loadIdColumn + " IN (" + String.join(", ", placeholders) + ")");
        }

        String loadType = request.partitionLoadType();
        if (config.supportsLoadType(loadType)) {
            String placeholder = params.add("lt_" + token, loadType.trim().toUpperCase(Locale.ROOT));
            predicates.add("UPPER(" + quoteIdentifier(config.loadTypeColumn()) + ") = " + placeholder);
        } else if (loadType != null && !loadType.isBlank()) {
            logger.debug("Load type {} not applicable to {}", loadType, dataset);
        }
        return predicates;
    }
}
