package com.stagesql.expression;

import com.stagesql.config.RenderDefaults;
import com.stagesql.exception.InvalidComparisonOperatorException;
import com.stagesql.generator.SQLQuoting;
import com.stagesql.validation.IdentifierValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Row-value predicate: {@code <path> <operator> <value>}.
 *
 * <p>Examples:
 * <pre>
 *   new Predicate("age", "&gt;", 30)                → ("age" &gt; ?)           [30]
 *   new Predicate("age", "=", null)                → ("age" IS NULL)         []
 *   new Predicate("name", "IN", List.of("a", "b")) → ("name" IN (?, ?))      [a, b]
 *   new Predicate("labels[*]", "=", "x")           → ("labels" LIKE ?)       [%x%]
 *   new Predicate("a", "=", new Column("b", "t"))  → ("a" = "t"."b")         []
 * </pre>
 *
 * <p>A path ending in {@code [*]} names a multi-valued property whose list is
 * stored as one encoded string. The marker is stripped, scalar values are
 * wrapped in {@code %} wildcards, and {@code =} / {@code !=} become
 * {@code LIKE} / {@code NOT LIKE}.
 */
public final class Predicate {

    private final String lhs;
    private final ComparisonOperator operator;
    private final PredicateValue rhs;

    /**
     * Creates a predicate from an operator symbol.
     *
     * @param lhs the property path, optionally ending in {@code [*]}
     * @param op the operator symbol
     * @param rhs the value: null, a scalar, a collection, or a {@link Column}
     * @throws InvalidComparisonOperatorException if the operator is unsupported
     *         or incompatible with the value
     */
    public Predicate(String lhs, String op, Object rhs) {
        this(lhs, ComparisonOperator.fromSymbol(op), rhs);
    }

    /**
     * Creates a predicate.
     *
     * @param lhs the property path, optionally ending in {@code [*]}
     * @param op the operator
     * @param rhs the value: null, a scalar, a collection, or a {@link Column}
     * @throws InvalidComparisonOperatorException if the operator cannot be used with the value
     */
    public Predicate(String lhs, ComparisonOperator op, Object rhs) {
        Objects.requireNonNull(op, "operator must not be null");
        if (op == ComparisonOperator.NOT_LIKE) {
            throw new InvalidComparisonOperatorException(op.symbol());
        }
        IdentifierValidator.validatePath(lhs);

        String path = lhs;
        ComparisonOperator operator = op;
        PredicateValue value = PredicateValue.of(rhs);

        if (IdentifierValidator.isMultiValued(lhs)) {
            path = IdentifierValidator.stripMultiValued(lhs);
            if (value instanceof PredicateValue.Literal literal) {
                value = new PredicateValue.Literal(
                    RenderDefaults.LIKE_WILDCARD + literal.value() + RenderDefaults.LIKE_WILDCARD);
                operator = operator.forMultiValued();
            } else if (!(value instanceof PredicateValue.Null)) {
                throw new InvalidComparisonOperatorException(
                    "Multi-valued path " + lhs + " can only be compared with a single value or NULL",
                    op.symbol());
            }
        }

        if (value instanceof PredicateValue.Null) {
            if (!operator.acceptsNull()) {
                throw new InvalidComparisonOperatorException(
                    "Operator " + operator.symbol() + " cannot compare against NULL", operator.symbol());
            }
        } else if (operator == ComparisonOperator.IN) {
            value = membershipValue(value);
        } else if (value instanceof PredicateValue.LiteralList) {
            throw new InvalidComparisonOperatorException(
                "Operator " + operator.symbol() + " cannot compare against a list of values", operator.symbol());
        }

        this.lhs = path;
        this.operator = operator;
        this.rhs = value;
    }

    private static PredicateValue membershipValue(PredicateValue value) {
        if (value instanceof PredicateValue.Literal literal) {
            return new PredicateValue.LiteralList(List.of(literal.value()));
        }
        if (value instanceof PredicateValue.LiteralList list) {
            if (list.values().isEmpty()) {
                throw new IllegalArgumentException("IN requires at least one value");
            }
            return list;
        }
        throw new InvalidComparisonOperatorException(
            "Operator IN requires a list of values", ComparisonOperator.IN.symbol());
    }

    /**
     * Returns the property path, with any multi-valued marker removed.
     *
     * @return the path
     */
    public String lhs() {
        return lhs;
    }

    /**
     * Returns the effective operator, after any multi-valued rewrite.
     *
     * @return the operator
     */
    public ComparisonOperator operator() {
        return operator;
    }

    public PredicateValue rhs() {
        return rhs;
    }

    /**
     * Returns the values this predicate binds, in placeholder order.
     *
     * @return the bound values
     */
    public List<Object> values() {
        return rhs.boundValues();
    }

    /**
     * Renders this predicate, parenthesized.
     *
     * @param placeholder the parameter marker substituted for each bound value
     * @return the SQL text
     */
    public String toSQL(String placeholder) {
        String column = SQLQuoting.quoteIdentifier(lhs);

        if (rhs instanceof PredicateValue.Null) {
            String check = operator.isNegatedNullCheck() ? " IS NOT NULL" : " IS NULL";
            return "(" + column + check + ")";
        }
        if (rhs instanceof PredicateValue.ColumnRef ref) {
            return "(" + column + " " + operator.symbol() + " " + ref.column().referenceSQL() + ")";
        }
        if (rhs instanceof PredicateValue.LiteralList list) {
            String placeholders = String.join(", ", Collections.nCopies(list.values().size(), placeholder));
            return "(" + column + " " + operator.symbol() + " (" + placeholders + "))";
        }
        return "(" + column + " " + operator.symbol() + " " + placeholder + ")";
    }

    /**
     * Concatenates the bound values of several predicates, in order.
     *
     * @param predicates the predicates
     * @return the bound values
     */
    public static List<Object> valuesOf(List<Predicate> predicates) {
        List<Object> values = new ArrayList<>();
        for (Predicate predicate : predicates) {
            values.addAll(predicate.values());
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Predicate other)) return false;
        return lhs.equals(other.lhs) && operator == other.operator && rhs.equals(other.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, operator, rhs);
    }

    @Override
    public String toString() {
        return String.format("Predicate(%s %s %s)", lhs, operator.symbol(), rhs);
    }
}
