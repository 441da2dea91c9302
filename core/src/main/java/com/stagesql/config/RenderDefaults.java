package com.stagesql.config;

/**
 * Fixed names and markers used while rendering queries.
 */
public final class RenderDefaults {

    private RenderDefaults() {} // Utility class

    /** Alias given to a wrapped subquery */
    public static final String SUBQUERY_ALIAS = "tmp";

    /** Output alias of row-count stages */
    public static final String COUNT_ALIAS = "count";

    /** Column wildcard, never quoted */
    public static final String WILDCARD = "*";

    /** Suffix marking a property path whose column stores an encoded list */
    public static final String MULTI_VALUED_MARKER = "[*]";

    /** SQL wildcard wrapped around values compared against multi-valued columns */
    public static final String LIKE_WILDCARD = "%";
}
