package com.stagesql.logical;

import com.stagesql.expression.CoalescedColumn;
import com.stagesql.expression.Column;
import com.stagesql.expression.SelectItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Stage picking the visible columns of the result (the select list).
 *
 * <p>Columns may be bare names, {@link Column} references or
 * {@link CoalescedColumn}s:
 * <pre>
 *   new Projection(List.of("a", new Column("b", "t", "bb")))  → SELECT "a", "t"."b" AS "bb"
 * </pre>
 *
 * <p>The select list is always emitted first, whatever position the
 * projection has in the stage list.
 */
public final class Projection extends Stage {

    private final List<SelectItem> columns;

    /**
     * Creates a projection.
     *
     * @param columns names, {@link Column}s and/or {@link CoalescedColumn}s
     */
    public Projection(List<?> columns) {
        Objects.requireNonNull(columns, "columns must not be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("columns must not be empty");
        }
        List<SelectItem> items = new ArrayList<>(columns.size());
        for (Object column : columns) {
            if (column instanceof SelectItem item) {
                items.add(item);
            } else {
                items.add(Column.of(column));
            }
        }
        this.columns = items;
    }

    /**
     * Returns the projected columns.
     *
     * @return an unmodifiable list of select items
     */
    public List<SelectItem> columns() {
        return Collections.unmodifiableList(columns);
    }

    @Override
    public StageKind kind() {
        return StageKind.PROJECTION;
    }

    @Override
    public String toSQL(String placeholder) {
        List<String> parts = new ArrayList<>(columns.size());
        for (SelectItem column : columns) {
            parts.add(column.toSQL());
        }
        return String.join(", ", parts);
    }

    @Override
    public String toString() {
        return String.format("Projection(%s)", columns);
    }
}
