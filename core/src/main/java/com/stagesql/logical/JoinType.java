package com.stagesql.logical;

import com.stagesql.exception.InvalidJoinTypeException;

import java.util.Locale;

/**
 * Supported join types.
 */
public enum JoinType {
    INNER("INNER"),
    OUTER("OUTER"),
    LEFT_OUTER("LEFT OUTER"),
    CROSS("CROSS");

    private final String keyword;

    JoinType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the SQL keyword placed before {@code JOIN}.
     *
     * @return the keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Parses a join type (case-insensitive, e.g. {@code "left outer"}).
     *
     * @param how the join type text
     * @return the join type
     * @throws InvalidJoinTypeException if how is not a supported join type
     */
    public static JoinType fromName(String how) {
        if (how != null) {
            String normalized = how.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
            for (JoinType type : values()) {
                if (type.keyword.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new InvalidJoinTypeException(how);
    }
}
