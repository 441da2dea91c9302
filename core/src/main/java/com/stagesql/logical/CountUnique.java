package com.stagesql.logical;

import com.stagesql.config.RenderDefaults;
import com.stagesql.expression.Column;
import com.stagesql.expression.SelectItem;
import com.stagesql.generator.SQLQuoting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stage counting the distinct rows of the result.
 *
 * <p>With columns it renders {@code COUNT(DISTINCT "a", "b") AS "count"}.
 * Without columns it renders {@code COUNT(*) AS "count"} and the render fold
 * counts over a {@code SELECT DISTINCT *} subquery instead.
 *
 * <p>Usually produced by {@link Query#append(Stage)} folding
 * Projection + Unique + Count into one stage.
 */
public final class CountUnique extends Stage {

    private final List<SelectItem> columns;

    /**
     * Creates a distinct-row count over the given columns.
     *
     * @param columns bare names, {@link Column}s or other select items; may be empty
     */
    public CountUnique(List<?> columns) {
        List<SelectItem> items = new ArrayList<>();
        if (columns != null) {
            for (Object column : columns) {
                if (column instanceof SelectItem item) {
                    items.add(item);
                } else {
                    items.add(Column.of(column));
                }
            }
        }
        this.columns = items;
    }

    /**
     * Creates a distinct-row count over whole rows.
     */
    public CountUnique() {
        this(null);
    }

    /**
     * Returns the counted columns.
     *
     * @return an unmodifiable list, empty when whole rows are counted
     */
    public List<SelectItem> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Checks whether this stage counts over specific columns.
     *
     * @return true if columns were given or absorbed
     */
    public boolean hasColumns() {
        return !columns.isEmpty();
    }

    /**
     * Returns a copy counting over the given columns.
     *
     * @param columns the absorbed columns
     * @return the new stage
     */
    CountUnique withColumns(List<SelectItem> columns) {
        return new CountUnique(columns);
    }

    @Override
    public StageKind kind() {
        return StageKind.COUNT_UNIQUE;
    }

    @Override
    public String toSQL(String placeholder) {
        String alias = SQLQuoting.quoteIdentifier(RenderDefaults.COUNT_ALIAS);
        if (columns.isEmpty()) {
            return "COUNT(*) AS " + alias;
        }
        List<String> parts = new ArrayList<>(columns.size());
        for (SelectItem column : columns) {
            parts.add(column.referenceSQL());
        }
        return "COUNT(DISTINCT " + String.join(", ", parts) + ") AS " + alias;
    }

    @Override
    public String toString() {
        return columns.isEmpty() ? "CountUnique(all columns)" : String.format("CountUnique(%s)", columns);
    }
}
