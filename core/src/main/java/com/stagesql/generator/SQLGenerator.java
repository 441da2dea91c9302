package com.stagesql.generator;

import com.stagesql.config.RenderDefaults;
import com.stagesql.exception.InvalidQueryException;
import com.stagesql.exception.SQLGenerationException;
import com.stagesql.exception.ValidationException;
import com.stagesql.logical.CountUnique;
import com.stagesql.logical.Query;
import com.stagesql.logical.Stage;
import com.stagesql.logical.StageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Lowers the stage list of a {@link Query} to one parameterized SQL statement.
 *
 * <p>Rendering is a left-to-right fold over the stages. The accumulator holds
 * the SQL assembled so far, the kind of the previous stage and the values
 * bound so far; each step derives a new accumulator from the old one and the
 * current stage. Clauses are therefore written outside-in: a Table seeds
 * {@code FROM "t"}, a later Filter appends {@code WHERE ...}, and a later
 * Projection prefixes {@code SELECT ...}.
 *
 * <p>The generator holds no state and may be shared between threads.
 *
 * <p>Example usage:
 * <pre>
 *   Query query = new Query("people")
 *       .append(new Projection(List.of("name")))
 *       .append(new Limit(10));
 *   RenderedSQL rendered = new SQLGenerator().generate(query, "?");
 *   // SELECT "name" FROM "people" LIMIT 10
 * </pre>
 *
 * @see Query#render(String)
 */
public class SQLGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SQLGenerator.class);

    private static final String SELECT = "SELECT ";
    private static final String SELECT_DISTINCT = "SELECT DISTINCT ";

    /**
     * Generates SQL for a query.
     *
     * @param query the query to render
     * @param placeholder the parameter marker substituted for each bound value
     * @return the SQL text and the values, in placeholder order
     * @throws InvalidQueryException if the query has no Table stage
     * @throws SQLGenerationException if a stage cannot be rendered
     */
    public RenderedSQL generate(Query query, String placeholder) {
        Objects.requireNonNull(query, "query must not be null");
        if (placeholder == null || placeholder.isEmpty()) {
            throw new IllegalArgumentException("placeholder must not be empty");
        }
        if (query.tables().isEmpty()) {
            throw new InvalidQueryException("no table");
        }

        FoldState state = FoldState.EMPTY;
        Stage current = null;
        try {
            for (Stage stage : query.stages()) {
                current = stage;
                state = step(state, stage, placeholder);
            }
        } catch (SQLGenerationException | ValidationException | IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SQLGenerationException("Unexpected error during SQL generation", e, current);
        }

        String sql = state.sql().startsWith(SELECT) ? state.sql() : SELECT + "* " + state.sql();
        logger.debug("Rendered {} with {} bound value(s)", sql, state.values().size());
        return new RenderedSQL(sql, state.values());
    }

    private static FoldState step(FoldState state, Stage stage, String placeholder) {
        String text = stage.toSQL(placeholder);
        String sql = state.sql();
        return switch (stage.kind()) {
            case TABLE -> new FoldState("FROM " + text, StageKind.TABLE, List.of());
            case PROJECTION, AGGREGATION, COUNT -> state.next(select(text, sql), stage);
            case COUNT_UNIQUE -> {
                if (((CountUnique) stage).hasColumns()) {
                    yield state.next(select(text, sql), stage);
                }
                String distinct = sql.startsWith(SELECT) ? distinct(sql) : SELECT_DISTINCT + "* " + sql;
                yield state.next(wrap(text, distinct), stage);
            }
            case FILTER -> {
                String keyword;
                if (state.previousKind() == StageKind.FILTER) {
                    keyword = " AND ";
                } else if (state.previousKind() == StageKind.AGGREGATION) {
                    keyword = " HAVING ";
                } else {
                    keyword = " WHERE ";
                }
                yield state.next(sql + keyword + text, stage);
            }
            case GROUP -> state.next(sql + " GROUP BY " + text, stage);
            case ORDER -> state.next(sql + " ORDER BY " + text, stage);
            case LIMIT -> state.next(sql + " LIMIT " + text, stage);
            case OFFSET -> state.next(sql + " OFFSET " + text, stage);
            case JOIN -> state.next(sql + " " + text, stage);
            case UNIQUE -> {
                String distinct = sql.startsWith(SELECT) ? distinct(sql) : text + " " + sql;
                yield state.next(distinct, stage);
            }
        };
    }

    // A select list meeting an already-emitted SELECT wraps it as a subquery
    private static String select(String columns, String sql) {
        if (sql.startsWith(SELECT)) {
            return wrap(columns, sql);
        }
        return SELECT + columns + " " + sql;
    }

    private static String wrap(String columns, String sql) {
        logger.debug("Wrapping {} as subquery for {}", sql, columns);
        return SELECT + columns + " FROM (" + sql + ") AS " + RenderDefaults.SUBQUERY_ALIAS;
    }

    private static String distinct(String sql) {
        if (sql.startsWith(SELECT_DISTINCT)) {
            return sql;
        }
        return SELECT_DISTINCT + sql.substring(SELECT.length());
    }

    /**
     * Immutable accumulator of the render fold.
     */
    private record FoldState(String sql, StageKind previousKind, List<Object> values) {

        static final FoldState EMPTY = new FoldState("", null, List.of());

        FoldState next(String newSql, Stage stage) {
            List<Object> stageValues = stage.values();
            if (stageValues.isEmpty()) {
                return new FoldState(newSql, stage.kind(), values);
            }
            List<Object> combined = new ArrayList<>(values.size() + stageValues.size());
            combined.addAll(values);
            combined.addAll(stageValues);
            return new FoldState(newSql, stage.kind(), Collections.unmodifiableList(combined));
        }
    }
}
