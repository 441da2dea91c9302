package com.stagesql.validation;

import com.stagesql.config.RenderDefaults;
import com.stagesql.exception.InvalidIdentifierException;
import com.stagesql.exception.InvalidPathException;

import java.util.regex.Pattern;

/**
 * Validates identifiers and property paths before they are stored in a clause.
 *
 * <p>This is the injection gate of the query builder. Identifiers and paths are
 * interpolated into SQL text as quoted names, so anything that could close a
 * quote, end a statement or open a comment must be rejected here. Render never
 * re-validates.
 *
 * <p>Grammar:
 * <ul>
 *   <li><b>identifier:</b> {@code [A-Za-z_][A-Za-z0-9_]*}</li>
 *   <li><b>path:</b> identifiers joined by {@code .}, optionally followed by
 *       the multi-valued marker {@code [*]}</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   IdentifierValidator.validateIdentifier("network_traffic");   // ok
 *   IdentifierValidator.validatePath("src_ref.value");            // ok
 *   IdentifierValidator.validatePath("labels[*]");                // ok
 *   IdentifierValidator.validateIdentifier("users; DROP TABLE x"); // throws
 * </pre>
 */
public final class IdentifierValidator {

    private static final String SEGMENT = "[A-Za-z_][A-Za-z0-9_]*";

    private static final Pattern IDENTIFIER = Pattern.compile(SEGMENT);

    private static final Pattern PATH = Pattern.compile(
        SEGMENT + "(?:\\." + SEGMENT + ")*(?:" + Pattern.quote(RenderDefaults.MULTI_VALUED_MARKER) + ")?");

    private IdentifierValidator() {}

    /**
     * Validates a bare identifier (table name, join alias).
     *
     * @param identifier the identifier to validate
     * @throws InvalidIdentifierException if identifier is null, empty, or
     *         contains characters outside the identifier grammar
     */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new InvalidIdentifierException("Identifier cannot be null or empty", identifier);
        }

        if (!IDENTIFIER.matcher(identifier).matches()) {
            throw new InvalidIdentifierException(
                "Invalid identifier (must start with letter/underscore, " +
                "contain only alphanumeric/underscore): " + identifier, identifier);
        }
    }

    /**
     * Validates a dotted property path (column name, column alias).
     *
     * @param path the path to validate
     * @throws InvalidPathException if path is null, empty, or contains
     *         characters outside the path grammar
     */
    public static void validatePath(String path) {
        if (path == null || path.isEmpty()) {
            throw new InvalidPathException("Path cannot be null or empty", path);
        }

        if (!PATH.matcher(path).matches()) {
            throw new InvalidPathException(
                "Invalid path (must be dot-separated identifiers, " +
                "optionally ending in " + RenderDefaults.MULTI_VALUED_MARKER + "): " + path, path);
        }
    }

    /**
     * Validates a column name; the wildcard {@code *} is accepted as is.
     *
     * @param name the column name
     * @throws InvalidPathException if name is neither {@code *} nor a valid path
     */
    public static void validateColumnName(String name) {
        if (!RenderDefaults.WILDCARD.equals(name)) {
            validatePath(name);
        }
    }

    /**
     * Checks whether a path carries the multi-valued marker.
     *
     * @param path the path to check
     * @return true if the path ends in {@code [*]}
     */
    public static boolean isMultiValued(String path) {
        return path != null && path.endsWith(RenderDefaults.MULTI_VALUED_MARKER);
    }

    /**
     * Removes the multi-valued marker from a path.
     *
     * @param path the path
     * @return the path without its trailing {@code [*]}, or the path unchanged
     */
    public static String stripMultiValued(String path) {
        if (!isMultiValued(path)) {
            return path;
        }
        return path.substring(0, path.length() - RenderDefaults.MULTI_VALUED_MARKER.length());
    }
}
