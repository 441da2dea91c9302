package com.stagesql.exception;

/**
 * Thrown when a join kind is not one of INNER, OUTER, LEFT OUTER or CROSS.
 */
public class InvalidJoinTypeException extends ValidationException {

    public InvalidJoinTypeException(String joinType) {
        super("Unsupported join type: " + joinType, "join validation", joinType);
    }
}
