package com.stagesql.logical;

/**
 * The closed set of stage kinds.
 *
 * <p>Both the append-time rules in {@link Query} and the render fold in
 * {@link com.stagesql.generator.SQLGenerator} switch over this enum
 * exhaustively, so adding a kind fails compilation until both handle it.
 */
public enum StageKind {
    TABLE,
    PROJECTION,
    FILTER,
    ORDER,
    GROUP,
    AGGREGATION,
    OFFSET,
    LIMIT,
    COUNT,
    UNIQUE,
    COUNT_UNIQUE,
    JOIN
}
