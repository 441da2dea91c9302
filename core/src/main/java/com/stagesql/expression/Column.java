package com.stagesql.expression;

import com.stagesql.generator.SQLQuoting;
import com.stagesql.validation.IdentifierValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reference to a column, optionally qualified by its table and renamed by an alias.
 *
 * <p>Column references appear in:
 * <ul>
 *   <li>Projections: {@code SELECT "name", "t"."age" AS "years"}</li>
 *   <li>Groupings: {@code GROUP BY "t"."category"}</li>
 *   <li>Predicates comparing two columns: {@code ("a" = "t"."b")}</li>
 * </ul>
 *
 * <p>The name passes path validation unless it is the wildcard {@code *}; the
 * table passes identifier validation and the alias passes path validation.
 */
public final class Column implements SelectItem {

    private final String name;
    private final String table;
    private final String alias;

    /**
     * Creates a column reference.
     *
     * @param name the column name or {@code *}
     * @param table the owning table (may be null)
     * @param alias the output alias (may be null)
     */
    public Column(String name, String table, String alias) {
        IdentifierValidator.validateColumnName(name);
        if (table != null) {
            IdentifierValidator.validateIdentifier(table);
        }
        if (alias != null) {
            IdentifierValidator.validatePath(alias);
        }
        this.name = name;
        this.table = table;
        this.alias = alias;
    }

    /**
     * Creates a column reference qualified by its table.
     *
     * @param name the column name or {@code *}
     * @param table the owning table (may be null)
     */
    public Column(String name, String table) {
        this(name, table, null);
    }

    /**
     * Creates an unqualified column reference.
     *
     * @param name the column name or {@code *}
     */
    public Column(String name) {
        this(name, null, null);
    }

    /**
     * Converts a column specifier (a bare name or a {@link Column}) to a column.
     *
     * @param spec a {@code String} or a {@code Column}
     * @return the column
     * @throws IllegalArgumentException if spec is of another type
     */
    public static Column of(Object spec) {
        if (spec instanceof Column column) {
            return column;
        }
        if (spec instanceof String name) {
            return new Column(name);
        }
        throw new IllegalArgumentException(
            "expected column name or Column but received " +
            (spec == null ? "null" : spec.getClass().getSimpleName()));
    }

    /**
     * Converts a list of column specifiers.
     *
     * @param specs bare names and/or {@link Column} values
     * @return the columns, in order
     */
    public static List<Column> listOf(List<?> specs) {
        Objects.requireNonNull(specs, "columns must not be null");
        List<Column> columns = new ArrayList<>(specs.size());
        for (Object spec : specs) {
            columns.add(of(spec));
        }
        return columns;
    }

    public String name() {
        return name;
    }

    public String table() {
        return table;
    }

    public String alias() {
        return alias;
    }

    /**
     * Renders the column without its alias, as used in comparisons and groupings.
     *
     * @return {@code "name"}, {@code "table"."name"} or {@code "table".*}
     */
    @Override
    public String referenceSQL() {
        if (table != null) {
            return SQLQuoting.quoteQualified(table, name);
        }
        return SQLQuoting.quoteColumn(name);
    }

    @Override
    public String toSQL() {
        String result = referenceSQL();
        if (alias != null) {
            result += " AS " + SQLQuoting.quoteIdentifier(alias);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Column other)) return false;
        return name.equals(other.name) &&
               Objects.equals(table, other.table) &&
               Objects.equals(alias, other.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, table, alias);
    }

    @Override
    public String toString() {
        return toSQL();
    }
}
