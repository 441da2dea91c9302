package com.stagesql.logical;

import java.util.List;

/**
 * Base class for all stages of a query pipeline.
 *
 * <p>A stage is one clause appended to a {@link Query}; the ordered stage list
 * is the intermediate representation that is lowered to SQL by
 * {@link com.stagesql.generator.SQLGenerator}. Stages are immutable and
 * validate their identifiers once, when constructed.
 *
 * <p>Each stage renders its own clause text given the placeholder token, and
 * reports the values it binds in the order its placeholders appear.
 *
 * @see Query
 * @see StageKind
 */
public abstract sealed class Stage
    permits Table, Projection, Filter, Order, Group, Aggregation,
            Offset, Limit, Count, Unique, CountUnique, Join {

    /**
     * Returns the kind of this stage.
     *
     * @return the stage kind
     */
    public abstract StageKind kind();

    /**
     * Renders the clause text of this stage, without its leading keyword.
     *
     * @param placeholder the parameter marker substituted for each bound value
     * @return the clause text
     */
    public abstract String toSQL(String placeholder);

    /**
     * Returns the values this stage binds, in placeholder order.
     *
     * @return the bound values (empty by default)
     */
    public List<Object> values() {
        return List.of();
    }

    /**
     * Returns a human-readable string representation of this stage.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();
}
