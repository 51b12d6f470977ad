package com.querycraft.validation;

import com.querycraft.config.CompilerSettings;
import com.querycraft.exception.ValidationException;
import com.querycraft.request.AggregationSpec;
import com.querycraft.request.QueryRequest;

import java.util.Objects;

/**
 * Validates the shape of a request before compilation.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>The dataset must be named.</li>
 *   <li>A data query must name columns or aggregations; there is no implicit
 *       "select all". Count queries are exempt.</li>
 *   <li>The limit must be between 1 and the configured maximum; the offset
 *       must not be negative.</li>
 *   <li>Aggregations must name a source column.</li>
 * </ul>
 *
 * <p>Column and table names are not checked against any schema; the database
 * reports unknown names when the statement runs.
 *
 * <p>Example usage:
 * <pre>
 *   new RequestValidator(settings).validate(request, false);  // Throws ValidationException if invalid
 *   CompiledQuery query = generator.compile(request);
 * </pre>
 *
 * @see ValidationException
 * @see com.querycraft.generator.SQLGenerator
 */
public class RequestValidator {

    private final CompilerSettings settings;

    public RequestValidator(CompilerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Validates a request.
     *
     * @param request the request
     * @param countOnly whether the request is compiled into a row count
     * @throws ValidationException if the request is malformed
     */
    public void validate(QueryRequest request, boolean countOnly) {
        Objects.requireNonNull(request, "request must not be null");

        if (request.dataset().isBlank()) {
            throw new ValidationException(
                "Dataset must not be blank",
                "request validation",
                request.toString(),
                "Name the base dataset, e.g. \"HR.EMPLOYEES\"");
        }

        if (!countOnly && request.columns().isEmpty() && !request.hasAggregations()) {
            throw new ValidationException(
                "Request selects no columns",
                "request validation",
                request.toString(),
                "List the columns to return or add an aggregation");
        }

        if (!countOnly) {
            validatePaging(request);
        }

        for (AggregationSpec aggregation : request.aggregations()) {
            if (aggregation.sourceColumn().isBlank()) {
                throw new ValidationException(
                    "Aggregation " + aggregation.function().token() + " has no column",
                    "aggregation validation",
                    aggregation.toString(),
                    "Name the column to aggregate");
            }
        }
    }

    private void validatePaging(QueryRequest request) {
        if (request.limit() < 1 || request.limit() > settings.maxLimit()) {
            throw new ValidationException(
                "Limit " + request.limit() + " is out of range",
                "request validation",
                String.valueOf(request.limit()),
                "Use a limit between 1 and " + settings.maxLimit());
        }
        if (request.offset() < 0) {
            throw new ValidationException(
                "Offset must not be negative: " + request.offset(),
                "request validation",
                String.valueOf(request.offset()));
        }
    }
}
