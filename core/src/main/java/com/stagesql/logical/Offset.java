package com.stagesql.logical;

/**
 * Stage skipping the first rows of the result (OFFSET clause).
 */
public final class Offset extends Stage {

    private final long offset;

    /**
     * Creates an offset stage.
     *
     * @param offset the number of rows to skip
     */
    public Offset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative");
        }
        this.offset = offset;
    }

    public long offset() {
        return offset;
    }

    @Override
    public StageKind kind() {
        return StageKind.OFFSET;
    }

    @Override
    public String toSQL(String placeholder) {
        return Long.toString(offset);
    }

    @Override
    public String toString() {
        return String.format("Offset(%d)", offset);
    }
}
