package com.stagesql.logical;

/**
 * Stage reducing the result to distinct rows.
 *
 * <p>SQL generation rewrites an emitted {@code SELECT} into
 * {@code SELECT DISTINCT}, or emits {@code SELECT DISTINCT *} when the query
 * has no select list yet.
 */
public final class Unique extends Stage {

    @Override
    public StageKind kind() {
        return StageKind.UNIQUE;
    }

    @Override
    public String toSQL(String placeholder) {
        return "SELECT DISTINCT *";
    }

    @Override
    public String toString() {
        return "Unique()";
    }
}
