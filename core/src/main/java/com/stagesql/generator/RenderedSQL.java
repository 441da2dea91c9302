package com.stagesql.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The result of rendering a query: SQL text plus the values to bind.
 *
 * <p>The i-th value binds to the i-th placeholder occurrence in the text,
 * counting left to right.
 *
 * @param sql the SQL text
 * @param values the bound values, in placeholder order
 */
public record RenderedSQL(String sql, List<Object> values) {

    public RenderedSQL {
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(values, "values must not be null");
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Counts the occurrences of a placeholder token in the SQL text.
     *
     * @param placeholder the placeholder token
     * @return the number of non-overlapping occurrences
     */
    public int placeholderCount(String placeholder) {
        if (placeholder == null || placeholder.isEmpty()) {
            throw new IllegalArgumentException("placeholder must not be empty");
        }
        int count = 0;
        int index = sql.indexOf(placeholder);
        while (index >= 0) {
            count++;
            index = sql.indexOf(placeholder, index + placeholder.length());
        }
        return count;
    }
}
