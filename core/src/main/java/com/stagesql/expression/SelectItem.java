package com.stagesql.expression;

/**
 * An entry of a select list: a plain or qualified column, or a coalesced column.
 *
 * <p>Select items are validated when constructed and render to SQL text
 * without bound values.
 */
public sealed interface SelectItem permits Column, CoalescedColumn {

    /**
     * Renders this item as it appears in a select list, alias included.
     *
     * @return the SQL text
     */
    String toSQL();

    /**
     * Renders this item as an expression, without its alias, as used inside
     * {@code COUNT(DISTINCT ...)} and {@code GROUP BY}.
     *
     * @return the SQL text
     */
    String referenceSQL();
}
