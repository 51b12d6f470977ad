package com.querycraft.exception;

/**
 * Exception thrown when a request is malformed and is rejected before compilation.
 *
 * <p>Validation failures describe the phase that rejected the input, the input
 * itself and a suggestion for fixing it:
 * <pre>
 *   throw new ValidationException(
 *       "Operator 'between' requires exactly 2 values",
 *       "filter validation",
 *       "[2020-01-01]",
 *       "Provide a start and an end value");
 * </pre>
 *
 * @see com.querycraft.validation.RequestValidator
 */
public class ValidationException extends RuntimeException {

    private final String phase;
    private final String invalidInput;
    private final String suggestion;

    /**
     * Creates a validation exception.
     *
     * @param message the error message
     * @param phase the validation phase that failed
     * @param invalidInput the rejected input, rendered as text
     * @param suggestion how to fix the input (may be null)
     */
    public ValidationException(String message, String phase, String invalidInput, String suggestion) {
        super(message);
        this.phase = phase;
        this.invalidInput = invalidInput;
        this.suggestion = suggestion;
    }

    /**
     * Creates a validation exception without a suggestion.
     *
     * @param message the error message
     * @param phase the validation phase that failed
     * @param invalidInput the rejected input, rendered as text
     */
    public ValidationException(String message, String phase, String invalidInput) {
        this(message, phase, invalidInput, null);
    }

    public String phase() {
        return phase;
    }

    public String invalidInput() {
        return invalidInput;
    }

    public String suggestion() {
        return suggestion;
    }

    /**
     * Returns a user-friendly error message including the suggestion, if any.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Invalid request (").append(phase).append("): ").append(getMessage());
        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append(". ").append(suggestion);
        }
        return sb.toString();
    }
}
