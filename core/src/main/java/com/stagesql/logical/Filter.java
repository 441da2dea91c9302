package com.stagesql.logical;

import com.stagesql.expression.Predicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Stage filtering rows with predicates combined by one boolean operator.
 *
 * <p>Examples:
 * <pre>
 *   new Filter(List.of(p1, p2))                      → ("a" = ?) AND ("b" &gt; ?)
 *   new Filter(List.of(p1, p2), BooleanOperator.OR)  → (("a" = ?) OR ("b" &gt; ?))
 * </pre>
 *
 * <p>An OR filter is parenthesized as a unit so that it composes with the
 * filters chained before and after it. The keyword in front of the text
 * ({@code WHERE}, {@code AND} or {@code HAVING}) is chosen by the render fold.
 */
public final class Filter extends Stage {

    private final List<Predicate> predicates;
    private final BooleanOperator operator;

    /**
     * Creates a filter.
     *
     * @param predicates the predicates, in order
     * @param operator the operator combining them
     */
    public Filter(List<Predicate> predicates, BooleanOperator operator) {
        Objects.requireNonNull(predicates, "predicates must not be null");
        if (predicates.isEmpty()) {
            throw new IllegalArgumentException("predicates must not be empty");
        }
        this.predicates = new ArrayList<>(predicates);
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
    }

    /**
     * Creates a filter whose predicates must all hold.
     *
     * @param predicates the predicates, in order
     */
    public Filter(List<Predicate> predicates) {
        this(predicates, BooleanOperator.AND);
    }

    /**
     * Returns the predicates.
     *
     * @return an unmodifiable list of predicates
     */
    public List<Predicate> predicates() {
        return Collections.unmodifiableList(predicates);
    }

    public BooleanOperator operator() {
        return operator;
    }

    @Override
    public StageKind kind() {
        return StageKind.FILTER;
    }

    @Override
    public String toSQL(String placeholder) {
        List<String> parts = new ArrayList<>(predicates.size());
        for (Predicate predicate : predicates) {
            parts.add(predicate.toSQL(placeholder));
        }
        String result = String.join(operator.separator(), parts);
        if (operator == BooleanOperator.OR) {
            return "(" + result + ")";
        }
        return result;
    }

    @Override
    public List<Object> values() {
        return Predicate.valuesOf(predicates);
    }

    @Override
    public String toString() {
        return String.format("Filter(%s, %s)", operator, predicates);
    }
}
