package com.stagesql.config;

import java.util.Locale;

/**
 * Positional parameter marker styles understood by common SQL drivers.
 *
 * <ul>
 *   <li>{@code QMARK}: {@code ?}, used by JDBC and SQLite</li>
 *   <li>{@code FORMAT}: {@code %s}, used by Postgres drivers with format-style binding</li>
 * </ul>
 *
 * <p>Any other non-empty token can be passed to
 * {@link com.stagesql.logical.Query#render(String)} directly.
 */
public enum ParamStyle {

    QMARK("?"),
    FORMAT("%s");

    private final String token;

    ParamStyle(String token) {
        this.token = token;
    }

    /**
     * Returns the placeholder token substituted at every bound-value position.
     *
     * @return the placeholder token
     */
    public String token() {
        return token;
    }

    /**
     * Parse a style name (case-insensitive).
     *
     * @param value "qmark" or "format"
     * @return the parsed style, {@code QMARK} when value is null
     * @throws IllegalArgumentException if value is not recognized
     */
    public static ParamStyle parse(String value) {
        if (value == null) {
            return QMARK;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "qmark", "?" -> QMARK;
            case "format", "%s" -> FORMAT;
            default -> throw new IllegalArgumentException(
                "Unknown parameter style: '%s'. Valid values: qmark, format".formatted(value));
        };
    }
}
