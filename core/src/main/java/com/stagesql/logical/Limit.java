package com.stagesql.logical;

/**
 * Stage capping the number of rows returned (LIMIT clause).
 *
 * <p>Combine with {@link Offset} for paging:
 * <pre>
 *   query.append(new Limit(100)).append(new Offset(50))  → ... LIMIT 100 OFFSET 50
 * </pre>
 */
public final class Limit extends Stage {

    private final long limit;

    /**
     * Creates a limit stage.
     *
     * @param limit the maximum number of rows to return
     */
    public Limit(long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative");
        }
        this.limit = limit;
    }

    public long limit() {
        return limit;
    }

    @Override
    public StageKind kind() {
        return StageKind.LIMIT;
    }

    @Override
    public String toSQL(String placeholder) {
        return Long.toString(limit);
    }

    @Override
    public String toString() {
        return String.format("Limit(%d)", limit);
    }
}
