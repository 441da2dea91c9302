package com.stagesql.exception;

/**
 * Thrown when an aggregate function is not one of COUNT, SUM, MIN, MAX, AVG or NUNIQUE.
 */
public class InvalidAggregateFunctionException extends ValidationException {

    public InvalidAggregateFunctionException(String function) {
        super("Unsupported aggregate function: " + function, "aggregate validation", function);
    }
}
