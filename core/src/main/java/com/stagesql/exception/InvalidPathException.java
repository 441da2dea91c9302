package com.stagesql.exception;

/**
 * Thrown when a column name or property path is not a safe dotted path.
 */
public class InvalidPathException extends ValidationException {

    public InvalidPathException(String message, String path) {
        super(message, "path validation", path);
    }
}
