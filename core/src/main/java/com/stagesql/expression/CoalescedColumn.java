package com.stagesql.expression;

import com.stagesql.generator.SQLQuoting;
import com.stagesql.validation.IdentifierValidator;

import java.util.List;
import java.util.Objects;

/**
 * First non-null value of several columns, used after a join to merge
 * same-named columns coming from different tables.
 *
 * <p>Source names are emitted unquoted so that dotted names such as
 * {@code left_t.id} resolve as table-qualified references:
 * <pre>
 *   new CoalescedColumn(List.of("a.id", "b.id"), "id")  → COALESCE(a.id, b.id) AS "id"
 * </pre>
 */
public final class CoalescedColumn implements SelectItem {

    private final List<String> names;
    private final String alias;

    /**
     * Creates a coalesced column.
     *
     * @param names the source column names, in priority order
     * @param alias the output alias
     */
    public CoalescedColumn(List<String> names, String alias) {
        Objects.requireNonNull(names, "names must not be null");
        if (names.isEmpty()) {
            throw new IllegalArgumentException("names must not be empty");
        }
        for (String name : names) {
            IdentifierValidator.validateColumnName(name);
        }
        IdentifierValidator.validatePath(alias);
        this.names = List.copyOf(names);
        this.alias = alias;
    }

    public List<String> names() {
        return names;
    }

    public String alias() {
        return alias;
    }

    @Override
    public String referenceSQL() {
        return "COALESCE(" + String.join(", ", names) + ")";
    }

    @Override
    public String toSQL() {
        return referenceSQL() + " AS " + SQLQuoting.quoteIdentifier(alias);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoalescedColumn other)) return false;
        return names.equals(other.names) && alias.equals(other.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, alias);
    }

    @Override
    public String toString() {
        return toSQL();
    }
}
