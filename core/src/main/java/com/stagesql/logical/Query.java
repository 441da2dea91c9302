package com.stagesql.logical;

import com.stagesql.config.ParamStyle;
import com.stagesql.exception.InvalidQueryException;
import com.stagesql.expression.SelectItem;
import com.stagesql.generator.RenderedSQL;
import com.stagesql.generator.SQLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * An ordered pipeline of stages that renders to one parameterized SQL statement.
 *
 * <p>Stages are appended in pipeline order. Each append is checked against the
 * current last stage and may be rejected, merged with earlier stages, or
 * dropped:
 * <ul>
 *   <li><b>Aggregation:</b> rejected after any Projection; inherits the
 *       columns of an immediately preceding Group</li>
 *   <li><b>Join:</b> must follow a Table or Join, from which its left-hand
 *       table is resolved; dropped when identical to the preceding Join</li>
 *   <li><b>Count:</b> after a Unique, becomes a CountUnique, absorbing a
 *       Projection that precedes the Unique</li>
 *   <li><b>CountUnique:</b> absorbs an immediately preceding Projection</li>
 *   <li><b>Table:</b> pushed onto the table stack</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   RenderedSQL rendered = new Query("people")
 *       .append(new Filter(List.of(new Predicate("age", "&gt;", 30))))
 *       .render("?");
 *   // SELECT * FROM "people" WHERE ("age" &gt; ?)   [30]
 * </pre>
 *
 * <p>A Query is a plain mutable value and is not thread-safe. Rendering does
 * not modify it and always produces the same output for the same stages and
 * placeholder.
 *
 * @see SQLGenerator
 */
public final class Query {

    private static final Logger logger = LoggerFactory.getLogger(Query.class);

    private static final SQLGenerator GENERATOR = new SQLGenerator();

    private final List<Stage> stages = new ArrayList<>();
    private final Deque<String> tables = new ArrayDeque<>();

    /**
     * Creates an empty query.
     */
    public Query() {
    }

    /**
     * Creates a query reading from a table.
     *
     * @param table the table name
     */
    public Query(String table) {
        append(new Table(table));
    }

    /**
     * Creates a query from a list of stages, appended in order.
     *
     * @param stages the stages
     */
    public Query(List<? extends Stage> stages) {
        extend(stages);
    }

    /**
     * Appends a stage, applying the combinator rules.
     *
     * @param stage the stage to append
     * @return this query
     * @throws InvalidQueryException if the stage cannot follow the current stages
     */
    public Query append(Stage stage) {
        Objects.requireNonNull(stage, "stage must not be null");

        Stage combined = switch (stage.kind()) {
            case AGGREGATION -> combineAggregation((Aggregation) stage);
            case JOIN -> combineJoin((Join) stage);
            case COUNT -> combineCount((Count) stage);
            case COUNT_UNIQUE -> combineCountUnique((CountUnique) stage);
            case TABLE -> {
                tables.push(((Table) stage).name());
                yield stage;
            }
            case PROJECTION, FILTER, ORDER, GROUP, OFFSET, LIMIT, UNIQUE -> stage;
        };
        if (combined != null) {
            stages.add(combined);
        }
        return this;
    }

    /**
     * Appends several stages in order.
     *
     * @param stages the stages
     * @return this query
     */
    public Query extend(List<? extends Stage> stages) {
        Objects.requireNonNull(stages, "stages must not be null");
        for (Stage stage : stages) {
            append(stage);
        }
        return this;
    }

    private Aggregation combineAggregation(Aggregation aggregation) {
        for (Stage previous : stages) {
            if (previous.kind() == StageKind.PROJECTION) {
                throw new InvalidQueryException("cannot have Aggregation after Projection", aggregation);
            }
        }
        if (lastStage() instanceof Group group) {
            logger.debug("Aggregation inherits group columns {}", group.columns());
            return aggregation.withGroupColumns(group.columns());
        }
        return aggregation;
    }

    // Returns null when the join duplicates the previous one
    private Join combineJoin(Join join) {
        Stage last = lastStage();
        String previousName;
        if (last instanceof Table table) {
            previousName = table.name();
        } else if (last instanceof Join previousJoin) {
            if (isDuplicate(join, previousJoin)) {
                logger.debug("Dropping duplicate {}", join);
                return null;
            }
            previousName = previousJoin.referenceName();
        } else {
            throw new InvalidQueryException("Join must follow Table or Join", join);
        }

        Join resolved = join;
        if (join.leftTable() == null) {
            resolved = join.withLeftTable(previousName);
            logger.debug("Resolved left-hand table of {} to {}", join.table(), previousName);
        }
        return resolved;
    }

    // An unresolved incoming join would be resolved against the previous join,
    // so compare it as if it carried the previous join's left-hand table.
    private static boolean isDuplicate(Join incoming, Join previous) {
        if (incoming.leftTable() == null) {
            return previous.leftTable() != null && incoming.withLeftTable(previous.leftTable()).equals(previous);
        }
        return incoming.equals(previous);
    }

    private Stage combineCount(Count count) {
        if (!(lastStage() instanceof Unique)) {
            return count;
        }
        stages.remove(stages.size() - 1);

        List<SelectItem> columns = List.of();
        if (lastStage() instanceof Projection projection) {
            stages.remove(stages.size() - 1);
            columns = projection.columns();
        }
        logger.debug("Folded Unique + Count into CountUnique over {}", columns.isEmpty() ? "all columns" : columns);
        return new CountUnique(columns);
    }

    private CountUnique combineCountUnique(CountUnique countUnique) {
        if (lastStage() instanceof Projection projection) {
            stages.remove(stages.size() - 1);
            logger.debug("Folded Projection into CountUnique over {}", projection.columns());
            return countUnique.withColumns(projection.columns());
        }
        return countUnique;
    }

    /**
     * Returns the last appended stage.
     *
     * @return the last stage, or null if the query is empty
     */
    public Stage lastStage() {
        return stages.isEmpty() ? null : stages.get(stages.size() - 1);
    }

    /**
     * Returns the stages after all combinator rules were applied.
     *
     * @return an unmodifiable view of the stages
     */
    public List<Stage> stages() {
        return Collections.unmodifiableList(stages);
    }

    /**
     * Returns the tables appended so far, most recent first.
     *
     * @return a snapshot of the table stack
     */
    public List<String> tables() {
        return List.copyOf(tables);
    }

    /**
     * Renders this query to SQL text and its bound values.
     *
     * @param placeholder the parameter marker substituted for each bound value
     * @return the SQL text and the values, in placeholder order
     * @throws InvalidQueryException if no Table stage was appended
     */
    public RenderedSQL render(String placeholder) {
        return GENERATOR.generate(this, placeholder);
    }

    /**
     * Renders this query with the placeholder of a parameter style.
     *
     * @param style the parameter style
     * @return the SQL text and the values, in placeholder order
     */
    public RenderedSQL render(ParamStyle style) {
        Objects.requireNonNull(style, "style must not be null");
        return render(style.token());
    }

    @Override
    public String toString() {
        return String.format("Query(%s)", stages);
    }
}
