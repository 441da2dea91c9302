package com.stagesql.exception;

/**
 * Thrown when a comparison operator is outside the supported set, or cannot be
 * used with the right-hand value it was given (e.g. {@code <} against NULL).
 */
public class InvalidComparisonOperatorException extends ValidationException {

    public InvalidComparisonOperatorException(String message, String operator) {
        super(message, "operator validation", operator);
    }

    public InvalidComparisonOperatorException(String operator) {
        this("Unsupported comparison operator: " + operator, operator);
    }
}
