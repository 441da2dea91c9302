package com.stagesql.logical;

/**
 * Combinator joining the predicates of one {@link Filter}.
 */
public enum BooleanOperator {
    AND(" AND "),
    OR(" OR ");

    private final String separator;

    BooleanOperator(String separator) {
        this.separator = separator;
    }

    /**
     * Returns the text placed between two predicates.
     *
     * @return the separator, with surrounding spaces
     */
    public String separator() {
        return separator;
    }
}
