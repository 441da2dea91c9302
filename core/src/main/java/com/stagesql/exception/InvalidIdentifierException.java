package com.stagesql.exception;

/**
 * Thrown when a table name or alias is not a safe bare identifier.
 */
public class InvalidIdentifierException extends ValidationException {

    public InvalidIdentifierException(String message, String identifier) {
        super(message, "identifier validation", identifier);
    }
}
