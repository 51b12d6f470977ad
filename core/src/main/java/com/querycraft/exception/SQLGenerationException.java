package com.querycraft.exception;

/**
 * Exception thrown when a structurally valid request cannot be compiled to SQL.
 *
 * <p>This exception carries the request node that failed (a filter condition,
 * a logical group, a join or aggregation spec) so callers can point the user at
 * the offending part of their query.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Operator not allowed for the resolved column type</li>
 *   <li>Join referencing a dataset that is not yet part of the query</li>
 *   <li>Unsupported operator reaching the condition compiler</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       CompiledQuery query = generator.compile(request);
 *   } catch (SQLGenerationException e) {
 *       log.warn(e.getUserMessage());
 *       log.debug("Offending node: {}", e.context());
 *   }
 * </pre>
 *
 * @see com.querycraft.generator.SQLGenerator
 */
public class SQLGenerationException extends RuntimeException {

    private final Object context;

    /**
     * Creates a SQL generation exception.
     *
     * @param message the error message
     * @param context the request node that failed to compile (may be null)
     */
    public SQLGenerationException(String message, Object context) {
        super(context != null ? message + " (context: " + context + ")" : message);
        this.context = context;
    }

    /**
     * Creates a SQL generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param context the request node that failed to compile (may be null)
     */
    public SQLGenerationException(String message, Throwable cause, Object context) {
        super(context != null ? message + " (context: " + context + ")" : message, cause);
        this.context = context;
    }

    /**
     * Returns the request node that failed to compile.
     *
     * @return the offending node, or null if not available
     */
    public Object context() {
        return context;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String nodeType = context != null ? context.getClass().getSimpleName() : "unknown";

        switch (nodeType) {
            case "FilterCondition":
                return "A filter condition could not be applied. " +
                       "Check that the operator suits the column type: " + context;

            case "LogicalGroup":
                return "A filter group could not be applied. " +
                       "Please simplify the nested AND/OR logic.";

            case "JoinSpec":
                return "A join could not be built. " +
                       "Joins must start from the base dataset or a dataset joined earlier.";

            default:
                return "Failed to build the query: " + getMessage();
        }
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("SQL Generation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (context != null) {
            sb.append("Context Type: ").append(context.getClass().getName()).append("\n");
            sb.append("Context: ").append(context).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
