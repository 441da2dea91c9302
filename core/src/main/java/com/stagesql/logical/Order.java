package com.stagesql.logical;

import com.stagesql.generator.SQLQuoting;
import com.stagesql.validation.IdentifierValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Stage sorting the result (ORDER BY clause).
 *
 * <p>Each entry is a bare path (sorted ascending) or a {@link SortKey}:
 * <pre>
 *   new Order(List.of("name", new Order.SortKey("age", Direction.DESC)))  → ORDER BY "name" ASC, "age" DESC
 * </pre>
 */
public final class Order extends Stage {

    private final List<SortKey> sortKeys;

    /**
     * Creates an order stage.
     *
     * @param columns bare paths and/or {@link SortKey}s
     */
    public Order(List<?> columns) {
        Objects.requireNonNull(columns, "columns must not be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("columns must not be empty");
        }
        List<SortKey> keys = new ArrayList<>(columns.size());
        for (Object column : columns) {
            if (column instanceof SortKey key) {
                keys.add(key);
            } else if (column instanceof String path) {
                keys.add(new SortKey(path, Direction.ASC));
            } else {
                throw new IllegalArgumentException(
                    "expected path or SortKey but received " +
                    (column == null ? "null" : column.getClass().getSimpleName()));
            }
        }
        this.sortKeys = keys;
    }

    /**
     * Returns the sort keys.
     *
     * @return an unmodifiable list of sort keys
     */
    public List<SortKey> sortKeys() {
        return Collections.unmodifiableList(sortKeys);
    }

    @Override
    public StageKind kind() {
        return StageKind.ORDER;
    }

    @Override
    public String toSQL(String placeholder) {
        List<String> parts = new ArrayList<>(sortKeys.size());
        for (SortKey key : sortKeys) {
            parts.add(SQLQuoting.quoteIdentifier(key.path()) + " " + key.direction());
        }
        return String.join(", ", parts);
    }

    @Override
    public String toString() {
        return String.format("Order(%s)", sortKeys);
    }

    /**
     * A path and the direction it is sorted in.
     */
    public record SortKey(String path, Direction direction) {
        public SortKey {
            IdentifierValidator.validatePath(path);
            direction = (direction == null) ? Direction.ASC : direction;
        }

        /**
         * Creates a sort key from a direction name.
         *
         * @param path the path
         * @param direction "asc" or "desc" (case-insensitive)
         */
        public SortKey(String path, String direction) {
            this(path, Direction.parse(direction));
        }

        @Override
        public String toString() {
            return path + " " + direction;
        }
    }

    /**
     * Sort direction.
     */
    public enum Direction {
        ASC,
        DESC;

        /**
         * Parse a direction name (case-insensitive).
         *
         * @param value "asc" or "desc"
         * @return the parsed direction, {@code ASC} when value is null
         * @throws IllegalArgumentException if value is not recognized
         */
        public static Direction parse(String value) {
            if (value == null) {
                return ASC;
            }
            return switch (value.trim().toUpperCase(Locale.ROOT)) {
                case "ASC" -> ASC;
                case "DESC" -> DESC;
                default -> throw new IllegalArgumentException(
                    "Unknown sort direction: '%s'. Valid values: ASC, DESC".formatted(value));
            };
        }
    }
}
