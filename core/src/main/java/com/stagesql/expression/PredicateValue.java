package com.stagesql.expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Right-hand side of a {@link Predicate}, classified once at construction.
 *
 * <ul>
 *   <li>{@link Null}: the NULL marker, renders {@code IS [NOT] NULL}</li>
 *   <li>{@link Literal}: one bound value</li>
 *   <li>{@link LiteralList}: one bound value per element, for {@code IN}</li>
 *   <li>{@link ColumnRef}: another column, no bound value</li>
 * </ul>
 */
public sealed interface PredicateValue
    permits PredicateValue.Null, PredicateValue.Literal, PredicateValue.LiteralList, PredicateValue.ColumnRef {

    /**
     * Returns the values this right-hand side binds, in placeholder order.
     *
     * @return the bound values (empty for NULL and column references)
     */
    List<Object> boundValues();

    /**
     * Classifies a raw right-hand value.
     *
     * <p>{@code null} becomes {@link Null}; a {@link Column} becomes a
     * {@link ColumnRef}; a collection or array becomes a {@link LiteralList};
     * any other object becomes a {@link Literal}. The string {@code "NULL"} is
     * a literal, not the NULL marker.
     *
     * @param raw the raw value
     * @return the classified value
     */
    static PredicateValue of(Object raw) {
        if (raw == null) {
            return Null.INSTANCE;
        }
        if (raw instanceof PredicateValue value) {
            return value;
        }
        if (raw instanceof Column column) {
            return new ColumnRef(column);
        }
        if (raw instanceof Collection<?> collection) {
            return new LiteralList(new ArrayList<>(collection));
        }
        if (raw instanceof Object[] array) {
            return new LiteralList(Arrays.asList(array));
        }
        return new Literal(raw);
    }

    /** The NULL marker. */
    final class Null implements PredicateValue {
        public static final Null INSTANCE = new Null();

        private Null() {}

        @Override
        public List<Object> boundValues() {
            return List.of();
        }

        @Override
        public String toString() {
            return "NULL";
        }
    }

    /** A single bound value. */
    record Literal(Object value) implements PredicateValue {
        public Literal {
            Objects.requireNonNull(value, "value must not be null, use Null.INSTANCE");
        }

        @Override
        public List<Object> boundValues() {
            return List.of(value);
        }
    }

    /** A list of bound values for a membership test; null elements are bound as SQL NULL. */
    record LiteralList(List<Object> values) implements PredicateValue {
        public LiteralList {
            values = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(values, "values must not be null")));
        }

        @Override
        public List<Object> boundValues() {
            return values;
        }
    }

    /** Another column; compared identifier to identifier. */
    record ColumnRef(Column column) implements PredicateValue {
        public ColumnRef {
            Objects.requireNonNull(column, "column must not be null");
        }

        @Override
        public List<Object> boundValues() {
            return List.of();
        }
    }
}
