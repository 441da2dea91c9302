package com.stagesql.logical;

import com.stagesql.generator.SQLQuoting;
import com.stagesql.validation.IdentifierValidator;

/**
 * Stage selecting the table a query reads from.
 *
 * <p>SQL generation:
 * <pre>Table("people") → FROM "people"</pre>
 */
public final class Table extends Stage {

    private final String name;

    /**
     * Creates a table stage.
     *
     * @param name the table name
     * @throws com.stagesql.exception.InvalidIdentifierException if name is not a safe identifier
     */
    public Table(String name) {
        IdentifierValidator.validateIdentifier(name);
        this.name = name;
    }

    /**
     * Returns the table name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    @Override
    public StageKind kind() {
        return StageKind.TABLE;
    }

    @Override
    public String toSQL(String placeholder) {
        return SQLQuoting.quoteIdentifier(name);
    }

    @Override
    public String toString() {
        return String.format("Table(%s)", name);
    }
}
