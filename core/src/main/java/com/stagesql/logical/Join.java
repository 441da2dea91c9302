package com.stagesql.logical;

import com.stagesql.exception.InvalidComparisonOperatorException;
import com.stagesql.expression.ComparisonOperator;
import com.stagesql.expression.Predicate;
import com.stagesql.generator.SQLQuoting;
import com.stagesql.validation.IdentifierValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Stage joining another table onto the current FROM/JOIN chain.
 *
 * <p>The join condition is given in one of two forms:
 * <ul>
 *   <li>a column comparison: {@code new Join("b", "id", "=", "a_id")}
 *       → {@code INNER JOIN "b" ON "a"."id" = "b"."a_id"}</li>
 *   <li>a predicate list: {@code new Join("b", List.of(p1, p2))}
 *       → {@code INNER JOIN "b" ON (..) AND (..)}</li>
 * </ul>
 * A CROSS join takes no condition: {@link #cross(String, String)}
 * → {@code CROSS JOIN "b"}.
 *
 * <p>The left-hand table of a column comparison is either given explicitly or
 * resolved by {@link Query#append(Stage)} from the Table or Join that
 * immediately precedes this stage.
 *
 * <p>Supported join types: INNER, OUTER, LEFT OUTER, CROSS.
 */
public final class Join extends Stage {

    private final String table;
    private final String leftTable;
    private final String leftColumn;
    private final ComparisonOperator operator;
    private final String rightColumn;
    private final List<Predicate> predicates;
    private final JoinType joinType;
    private final String alias;

    private Join(String table, String leftTable, String leftColumn, ComparisonOperator operator,
                 String rightColumn, List<Predicate> predicates, JoinType joinType, String alias) {
        this.table = table;
        this.leftTable = leftTable;
        this.leftColumn = leftColumn;
        this.operator = operator;
        this.rightColumn = rightColumn;
        this.predicates = predicates;
        this.joinType = joinType;
        this.alias = alias;
    }

    /**
     * Creates a join on a column comparison.
     *
     * @param table the table to join
     * @param leftColumn the column of the left-hand table
     * @param op the comparison operator, e.g. {@code "="}
     * @param rightColumn the column of the joined table
     * @param how the join type, e.g. {@code "INNER"} or {@code "LEFT OUTER"}
     * @param alias an alias for the joined table (may be null)
     * @param leftTable the left-hand table (null to resolve it from the preceding stage)
     */
    public Join(String table, String leftColumn, String op, String rightColumn,
                String how, String alias, String leftTable) {
        this(table, leftTable, leftColumn, binaryOperator(op), rightColumn, null, JoinType.fromName(how), alias);
        Objects.requireNonNull(leftColumn, "leftColumn must not be null");
        Objects.requireNonNull(rightColumn, "rightColumn must not be null");
        if (joinType == JoinType.CROSS) {
            throw new IllegalArgumentException("condition must be null for CROSS join");
        }
        validateNames();
        IdentifierValidator.validatePath(leftColumn);
        IdentifierValidator.validatePath(rightColumn);
    }

    /**
     * Creates an inner join on a column comparison.
     *
     * @param table the table to join
     * @param leftColumn the column of the left-hand table
     * @param op the comparison operator
     * @param rightColumn the column of the joined table
     */
    public Join(String table, String leftColumn, String op, String rightColumn) {
        this(table, leftColumn, op, rightColumn, JoinType.INNER.keyword(), null, null);
    }

    /**
     * Creates a join on a list of predicates, combined with AND.
     *
     * @param table the table to join
     * @param predicates the join predicates
     * @param how the join type
     * @param alias an alias for the joined table (may be null)
     * @param leftTable the left-hand table (null to resolve it from the preceding stage)
     */
    public Join(String table, List<Predicate> predicates, String how, String alias, String leftTable) {
        this(table, leftTable, null, null, null, copyPredicates(predicates), JoinType.fromName(how), alias);
        if (joinType == JoinType.CROSS) {
            throw new IllegalArgumentException("condition must be null for CROSS join");
        }
        validateNames();
    }

    /**
     * Creates an inner join on a list of predicates.
     *
     * @param table the table to join
     * @param predicates the join predicates
     */
    public Join(String table, List<Predicate> predicates) {
        this(table, predicates, JoinType.INNER.keyword(), null, null);
    }

    /**
     * Creates a CROSS join.
     *
     * @param table the table to join
     * @param alias an alias for the joined table (may be null)
     * @return the join stage
     */
    public static Join cross(String table, String alias) {
        Join join = new Join(table, null, null, null, null, null, JoinType.CROSS, alias);
        join.validateNames();
        return join;
    }

    private void validateNames() {
        IdentifierValidator.validateIdentifier(table);
        if (alias != null) {
            IdentifierValidator.validateIdentifier(alias);
        }
        if (leftTable != null) {
            IdentifierValidator.validateIdentifier(leftTable);
        }
    }

    private static ComparisonOperator binaryOperator(String op) {
        ComparisonOperator operator = ComparisonOperator.fromSymbol(op);
        if (!operator.isBinary()) {
            throw new InvalidComparisonOperatorException(
                "Operator " + operator.symbol() + " cannot be used in a join condition", op);
        }
        return operator;
    }

    private static List<Predicate> copyPredicates(List<Predicate> predicates) {
        Objects.requireNonNull(predicates, "predicates must not be null");
        if (predicates.isEmpty()) {
            throw new IllegalArgumentException("predicates must not be empty");
        }
        return new ArrayList<>(predicates);
    }

    /**
     * Returns a copy whose left-hand table is set.
     *
     * @param name the left-hand table (already validated)
     * @return the resolved join
     */
    Join withLeftTable(String name) {
        return new Join(table, name, leftColumn, operator, rightColumn, predicates, joinType, alias);
    }

    public String table() {
        return table;
    }

    /**
     * Returns the left-hand table.
     *
     * @return the table, or null while unresolved
     */
    public String leftTable() {
        return leftTable;
    }

    public String leftColumn() {
        return leftColumn;
    }

    public ComparisonOperator operator() {
        return operator;
    }

    public String rightColumn() {
        return rightColumn;
    }

    /**
     * Returns the join predicates.
     *
     * @return an unmodifiable list, empty for column comparisons and CROSS joins
     */
    public List<Predicate> predicates() {
        return predicates == null ? List.of() : Collections.unmodifiableList(predicates);
    }

    public JoinType joinType() {
        return joinType;
    }

    public String alias() {
        return alias;
    }

    /**
     * Returns the name under which the joined table is referenced in SQL.
     *
     * @return the alias, or the table name when there is no alias
     */
    public String referenceName() {
        return alias != null ? alias : table;
    }

    @Override
    public StageKind kind() {
        return StageKind.JOIN;
    }

    @Override
    public String toSQL(String placeholder) {
        String target = SQLQuoting.quoteIdentifier(table);
        if (alias != null) {
            target += " AS " + SQLQuoting.quoteIdentifier(alias);
        }
        String head = joinType.keyword() + " JOIN " + target;
        if (joinType == JoinType.CROSS) {
            return head;
        }
        return head + " ON " + conditionSQL(placeholder);
    }

    private String conditionSQL(String placeholder) {
        if (predicates != null) {
            List<String> parts = new ArrayList<>(predicates.size());
            for (Predicate predicate : predicates) {
                parts.add(predicate.toSQL(placeholder));
            }
            return String.join(" AND ", parts);
        }
        if (leftTable == null) {
            throw new IllegalStateException("left-hand table of " + this + " was never resolved");
        }
        return SQLQuoting.quoteQualified(leftTable, leftColumn) + " " + operator.symbol() + " " +
               SQLQuoting.quoteQualified(referenceName(), rightColumn);
    }

    @Override
    public List<Object> values() {
        return predicates == null ? List.of() : Predicate.valuesOf(predicates);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Join other)) return false;
        return table.equals(other.table) &&
               Objects.equals(leftTable, other.leftTable) &&
               Objects.equals(leftColumn, other.leftColumn) &&
               operator == other.operator &&
               Objects.equals(rightColumn, other.rightColumn) &&
               Objects.equals(predicates, other.predicates) &&
               joinType == other.joinType &&
               Objects.equals(alias, other.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, leftTable, leftColumn, operator, rightColumn, predicates, joinType, alias);
    }

    @Override
    public String toString() {
        if (predicates != null) {
            return String.format("Join(%s %s, left=%s, predicates=%s, alias=%s)",
                joinType, table, leftTable, predicates, alias);
        }
        if (joinType == JoinType.CROSS) {
            return String.format("Join(%s %s, alias=%s)", joinType, table, alias);
        }
        return String.format("Join(%s %s, left=%s, %s %s %s, alias=%s)",
            joinType, table, leftTable, leftColumn, operator.symbol(), rightColumn, alias);
    }
}
