package com.stagesql.expression;

import com.stagesql.exception.InvalidComparisonOperatorException;

import java.util.Locale;

/**
 * Comparison operators allowed in predicates and join conditions.
 *
 * <p>{@link #NOT_LIKE} is never accepted from callers; it is only produced when
 * an inequality against a multi-valued path is rewritten.
 */
public enum ComparisonOperator {
    EQUAL("=", true),
    NOT_EQUAL_ANSI("<>", true),
    NOT_EQUAL("!=", true),
    LESS_THAN("<", true),
    GREATER_THAN(">", true),
    LESS_THAN_OR_EQUAL("<=", true),
    GREATER_THAN_OR_EQUAL(">=", true),
    LIKE("LIKE", true),
    NOT_LIKE("NOT LIKE", false),
    IN("IN", true),
    IS("IS", true),
    IS_NOT("IS NOT", true);

    private final String symbol;
    private final boolean accepted;

    ComparisonOperator(String symbol, boolean accepted) {
        this.symbol = symbol;
        this.accepted = accepted;
    }

    /**
     * Returns the SQL text of this operator.
     *
     * @return the operator symbol
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Parses a caller-supplied operator (case-insensitive for keyword operators).
     *
     * @param symbol the operator text, e.g. {@code "="} or {@code "is not"}
     * @return the operator
     * @throws InvalidComparisonOperatorException if the symbol is not in the comparison set
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol != null) {
            String normalized = symbol.trim().toUpperCase(Locale.ROOT);
            for (ComparisonOperator op : values()) {
                if (op.accepted && op.symbol.equals(normalized)) {
                    return op;
                }
            }
        }
        throw new InvalidComparisonOperatorException(symbol);
    }

    /**
     * Checks whether this operator may compare against NULL.
     *
     * @return true for equality, inequality and identity operators
     */
    public boolean acceptsNull() {
        switch (this) {
            case EQUAL:
            case NOT_EQUAL:
            case NOT_EQUAL_ANSI:
            case IS:
            case IS_NOT:
                return true;
            default:
                return false;
        }
    }

    /**
     * Checks whether this operator negates its comparison against NULL.
     *
     * @return true for {@code !=}, {@code <>} and {@code IS NOT}
     */
    public boolean isNegatedNullCheck() {
        return this == NOT_EQUAL || this == NOT_EQUAL_ANSI || this == IS_NOT;
    }

    /**
     * Checks whether this operator compares one value with exactly one other
     * value, as required in an {@code ON} clause.
     *
     * @return false for {@code IN}, {@code IS} and {@code IS NOT}
     */
    public boolean isBinary() {
        return this != IN && this != IS && this != IS_NOT;
    }

    /**
     * Returns the operator used against a multi-valued column, whose list is
     * stored as one encoded string: equality becomes a substring match.
     *
     * @return {@code LIKE} for {@code =}, {@code NOT LIKE} for {@code !=} and
     *         {@code <>}, this operator otherwise
     */
    public ComparisonOperator forMultiValued() {
        switch (this) {
            case EQUAL:
                return LIKE;
            case NOT_EQUAL:
            case NOT_EQUAL_ANSI:
                return NOT_LIKE;
            default:
                return this;
        }
    }
}
