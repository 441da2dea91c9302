package com.stagesql.logical;

import com.stagesql.exception.InvalidAggregateFunctionException;

import java.util.Locale;

/**
 * Aggregate functions allowed in an {@link Aggregation}.
 *
 * <p>{@code NUNIQUE} counts distinct values and lowers to {@code COUNT(DISTINCT ...)}.
 */
public enum AggregateFunction {
    COUNT,
    SUM,
    MIN,
    MAX,
    AVG,
    NUNIQUE;

    /**
     * Parses a function name (case-insensitive).
     *
     * @param name the function name
     * @return the function
     * @throws InvalidAggregateFunctionException if name is not an allowed function
     */
    public static AggregateFunction fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (AggregateFunction function : values()) {
                if (function.name().equals(normalized)) {
                    return function;
                }
            }
        }
        throw new InvalidAggregateFunctionException(name);
    }

    /**
     * Returns the SQL function emitted for this aggregate.
     *
     * @return the SQL function name
     */
    public String sqlName() {
        return this == NUNIQUE ? COUNT.name() : name();
    }

    /**
     * Checks whether the argument is prefixed with {@code DISTINCT}.
     *
     * @return true for {@code NUNIQUE}
     */
    public boolean isDistinct() {
        return this == NUNIQUE;
    }
}
