package com.stagesql.logical;

import com.stagesql.config.RenderDefaults;
import com.stagesql.expression.Column;
import com.stagesql.generator.SQLQuoting;
import com.stagesql.validation.IdentifierValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Stage computing aggregate functions over the rows (or over each group).
 *
 * <p>Examples:
 * <pre>
 *   new Aggregation(List.of(Aggregate.of("COUNT", "*", "n")))      → COUNT(*) AS "n"
 *   new Aggregation(List.of(Aggregate.of("sum", "bytes")))         → SUM("bytes") AS "sum"
 *   new Aggregation(List.of(Aggregate.of("NUNIQUE", "src", null))) → COUNT(DISTINCT "src") AS "count"
 * </pre>
 *
 * <p>When appended directly after a {@link Group}, the group columns are
 * copied in front of the aggregates, since SQL requires grouping columns to
 * appear in the select list alongside them:
 * <pre>
 *   Group("type") + Aggregation(COUNT(*) AS n)  → SELECT "type", COUNT(*) AS "n" ... GROUP BY "type"
 * </pre>
 */
public final class Aggregation extends Stage {

    private final List<Aggregate> aggregates;
    private final List<Column> groupColumns;

    /**
     * Creates an aggregation stage.
     *
     * @param aggregates the aggregate expressions, in order
     */
    public Aggregation(List<Aggregate> aggregates) {
        this(aggregates, List.of());
    }

    private Aggregation(List<Aggregate> aggregates, List<Column> groupColumns) {
        Objects.requireNonNull(aggregates, "aggregates must not be null");
        if (aggregates.isEmpty()) {
            throw new IllegalArgumentException("aggregates must not be empty");
        }
        this.aggregates = new ArrayList<>(aggregates);
        this.groupColumns = new ArrayList<>(groupColumns);
    }

    /**
     * Returns the aggregate expressions.
     *
     * @return an unmodifiable list of aggregates
     */
    public List<Aggregate> aggregates() {
        return Collections.unmodifiableList(aggregates);
    }

    /**
     * Returns the grouping columns inherited from a preceding {@link Group}.
     *
     * @return an unmodifiable list, empty when no group preceded this stage
     */
    public List<Column> groupColumns() {
        return Collections.unmodifiableList(groupColumns);
    }

    /**
     * Returns a copy that also emits the given grouping columns.
     *
     * @param columns the grouping columns
     * @return the new stage
     */
    Aggregation withGroupColumns(List<Column> columns) {
        return new Aggregation(aggregates, columns);
    }

    @Override
    public StageKind kind() {
        return StageKind.AGGREGATION;
    }

    @Override
    public String toSQL(String placeholder) {
        List<String> exprs = new ArrayList<>();
        for (Column column : groupColumns) {
            exprs.add(column.toSQL());
        }
        for (Aggregate aggregate : aggregates) {
            exprs.add(aggregate.toSQL());
        }
        return String.join(", ", exprs);
    }

    @Override
    public String toString() {
        return String.format("Aggregation(groupBy=%s, agg=%s)", groupColumns, aggregates);
    }

    /**
     * One aggregate expression: a function over a column (or {@code *}) with an alias.
     *
     * <p>The column is null or {@code *} for whole-row aggregates. The alias
     * defaults to the lower-cased SQL function name.
     */
    public record Aggregate(AggregateFunction function, String column, String alias) {
        public Aggregate {
            Objects.requireNonNull(function, "function must not be null");
            if (column != null) {
                IdentifierValidator.validateColumnName(column);
            }
            if (alias != null) {
                IdentifierValidator.validatePath(alias);
            }
        }

        /**
         * Creates an aggregate from a function name.
         *
         * @param function the function name (case-insensitive)
         * @param column the column, {@code *} or null
         * @param alias the alias, or null for the default
         * @return the aggregate
         * @throws com.stagesql.exception.InvalidAggregateFunctionException if function is not allowed
         */
        public static Aggregate of(String function, String column, String alias) {
            return new Aggregate(AggregateFunction.fromName(function), column, alias);
        }

        /**
         * Creates an aggregate with the default alias.
         *
         * @param function the function name (case-insensitive)
         * @param column the column, {@code *} or null
         * @return the aggregate
         */
        public static Aggregate of(String function, String column) {
            return of(function, column, null);
        }

        /**
         * Returns the output alias, defaulted when none was given.
         *
         * @return the alias
         */
        public String effectiveAlias() {
            return alias != null ? alias : function.sqlName().toLowerCase(Locale.ROOT);
        }

        /**
         * Renders {@code FUNC([DISTINCT ]arg) AS "alias"}.
         *
         * @return the SQL text
         */
        public String toSQL() {
            String argument = (column == null || RenderDefaults.WILDCARD.equals(column))
                ? RenderDefaults.WILDCARD
                : SQLQuoting.quoteIdentifier(column);
            String modifier = function.isDistinct() ? "DISTINCT " : "";
            return function.sqlName() + "(" + modifier + argument + ") AS " +
                   SQLQuoting.quoteIdentifier(effectiveAlias());
        }
    }
}
