package com.stagesql.generator;

import com.stagesql.config.RenderDefaults;

import java.util.ArrayList;
import java.util.List;

/**
 * Utilities for quoting SQL identifiers in rendered text.
 *
 * <p>Quoting is the last line of the injection boundary, not the first: every
 * name reaching these methods has already passed
 * {@link com.stagesql.validation.IdentifierValidator}. Values are never
 * quoted here; they are always bound as parameters.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("users");      // "users"
 *   SQLQuoting.quoteColumn("*");              // *
 *   SQLQuoting.quoteQualified("t", "id");     // "t"."id"
 * </pre>
 *
 * @see SQLGenerator
 */
public final class SQLQuoting {

    private SQLQuoting() {}

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * <p>Uses double quotes and escapes internal quotes according to SQL standard.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        // Escape double quotes by doubling them (SQL standard)
        String escaped = identifier.replace("\"", "\"\"");
        return "\"" + escaped + "\"";
    }

    /**
     * Quotes a column name, leaving the wildcard untouched.
     *
     * @param column the column name or {@code *}
     * @return the quoted column, or {@code *}
     */
    public static String quoteColumn(String column) {
        if (RenderDefaults.WILDCARD.equals(column)) {
            return column;
        }
        return quoteIdentifier(column);
    }

    /**
     * Quotes a column qualified by its table.
     *
     * @param table the table name or alias
     * @param column the column name or {@code *}
     * @return {@code "table"."column"} or {@code "table".*}
     */
    public static String quoteQualified(String table, String column) {
        return quoteIdentifier(table) + "." + quoteColumn(column);
    }

    /**
     * Quotes each column and joins them with {@code ", "}.
     *
     * @param columns the column names
     * @return the comma separated, quoted column list
     */
    public static String quoteColumnList(List<String> columns) {
        List<String> quoted = new ArrayList<>(columns.size());
        for (String column : columns) {
            quoted.add(quoteColumn(column));
        }
        return String.join(", ", quoted);
    }
}
