package com.stagesql.logical;

import com.stagesql.expression.Column;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Stage grouping rows by one or more columns (GROUP BY clause).
 *
 * <p>Columns render without their alias. A table-qualified {@link Column}
 * renders as {@code "table"."name"}, the same way it does in a projection.
 *
 * <p>An {@link Aggregation} appended directly after a Group copies the group
 * columns into its select list.
 */
public final class Group extends Stage {

    private final List<Column> columns;

    /**
     * Creates a group stage.
     *
     * @param columns bare names and/or {@link Column}s
     */
    public Group(List<?> columns) {
        Objects.requireNonNull(columns, "columns must not be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("columns must not be empty");
        }
        this.columns = Column.listOf(columns);
    }

    /**
     * Returns the grouping columns.
     *
     * @return an unmodifiable list of columns
     */
    public List<Column> columns() {
        return Collections.unmodifiableList(columns);
    }

    @Override
    public StageKind kind() {
        return StageKind.GROUP;
    }

    @Override
    public String toSQL(String placeholder) {
        List<String> parts = new ArrayList<>(columns.size());
        for (Column column : columns) {
            parts.add(column.referenceSQL());
        }
        return String.join(", ", parts);
    }

    @Override
    public String toString() {
        return String.format("Group(%s)", columns);
    }
}
