package com.stagesql.exception;

/**
 * Exception thrown when caller input is rejected while a clause is constructed.
 *
 * <p>Every identifier, path, operator, join kind and aggregate function passes
 * through a validation gate before it is stored in a clause. When the gate
 * rejects an input this exception (or one of its subclasses) is raised, and the
 * query under construction must be discarded.
 *
 * <p>Subclasses:
 * <ul>
 *   <li>{@link InvalidIdentifierException} - unsafe table name or alias</li>
 *   <li>{@link InvalidPathException} - unsafe column or property path</li>
 *   <li>{@link InvalidComparisonOperatorException} - operator outside the comparison set</li>
 *   <li>{@link InvalidJoinTypeException} - join kind outside the allowed kinds</li>
 *   <li>{@link InvalidAggregateFunctionException} - aggregate outside the allowed functions</li>
 * </ul>
 */
public class ValidationException extends RuntimeException {

    private final String validationPhase;
    private final String invalidInput;

    /**
     * Creates a validation exception.
     *
     * @param message the error message
     * @param validationPhase the gate that rejected the input (e.g. "identifier validation")
     * @param invalidInput the rejected input, may be null
     */
    public ValidationException(String message, String validationPhase, String invalidInput) {
        super(message);
        this.validationPhase = validationPhase;
        this.invalidInput = invalidInput;
    }

    /**
     * Returns the gate that rejected the input.
     *
     * @return the validation phase
     */
    public String getValidationPhase() {
        return validationPhase;
    }

    /**
     * Returns the rejected input.
     *
     * @return the input, or null if not available
     */
    public String getInvalidInput() {
        return invalidInput;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return message naming the phase and the rejected input
     */
    public String getUserMessage() {
        if (invalidInput == null) {
            return "Query rejected during " + validationPhase + ": " + getMessage();
        }
        return "Query rejected during " + validationPhase + ": " + getMessage() +
               " (input: " + invalidInput + ")";
    }
}
