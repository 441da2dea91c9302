package com.stagesql.logical;

import com.stagesql.exception.InvalidQueryException;
import com.stagesql.expression.Column;
import com.stagesql.expression.Predicate;
import com.stagesql.logical.Aggregation.Aggregate;
import com.stagesql.test.TestBase;
import com.stagesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the rules applied when a stage is appended to a query.
 */
@DisplayName("Query Combinator Tests")
@TestCategories.Unit
public class QueryCombinatorTest extends TestBase {

    private static Filter filter(String path, String op, Object value) {
        return new Filter(List.of(new Predicate(path, op, value)));
    }

    @Nested
    @DisplayName("Aggregation")
    class AggregationRules {

        @Test
        @DisplayName("Aggregation after a Projection is rejected")
        void testAggregationAfterProjection() {
            Query query = new Query("events").append(new Projection(List.of("type")));

            assertThatThrownBy(() -> query.append(new Aggregation(List.of(Aggregate.of("count", "*")))))
                .isInstanceOf(InvalidQueryException.class)
                .hasMessageContaining("cannot have Aggregation after Projection");
        }

        @Test
        @DisplayName("Aggregation is rejected even when stages separate it from the Projection")
        void testAggregationAfterProjectionWithIntermediateStages() {
            // Given: Projection, then a Filter and a Group
            Query query = new Query("events")
                .append(new Projection(List.of("type")))
                .append(filter("status", "=", "ok"))
                .append(new Group(List.of("type")));

            // When/Then
            assertThatThrownBy(() -> query.append(new Aggregation(List.of(Aggregate.of("count", "*")))))
                .isInstanceOf(InvalidQueryException.class);
            assertThat(query.stages()).hasSize(4);
        }

        @Test
        @DisplayName("Aggregation directly after a Group inherits its columns")
        void testAggregationInheritsGroupColumns() {
            Query query = new Query("events")
                .append(new Group(List.of("type", new Column("region", "events"))))
                .append(new Aggregation(List.of(Aggregate.of("count", "*", "n"))));

            Aggregation aggregation = (Aggregation) query.lastStage();
            assertThat(aggregation.groupColumns())
                .containsExactly(new Column("type"), new Column("region", "events"));
        }

        @Test
        @DisplayName("Aggregation not directly after a Group has no group columns")
        void testAggregationWithoutGroup() {
            Query query = new Query("events")
                .append(new Group(List.of("type")))
                .append(filter("status", "=", "ok"))
                .append(new Aggregation(List.of(Aggregate.of("count", "*"))));

            assertThat(((Aggregation) query.lastStage()).groupColumns()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Join")
    class JoinRules {

        @Test
        @DisplayName("Join without a preceding Table is rejected")
        void testJoinOnEmptyQuery() {
            assertThatThrownBy(() -> new Query().append(new Join("orders", "id", "=", "customer_id")))
                .isInstanceOf(InvalidQueryException.class)
                .hasMessageContaining("Join must follow Table or Join");
        }

        @Test
        @DisplayName("Join after a Filter is rejected")
        void testJoinAfterFilter() {
            Query query = new Query("customers").append(filter("active", "=", true));

            assertThatThrownBy(() -> query.append(new Join("orders", "id", "=", "customer_id")))
                .isInstanceOf(InvalidQueryException.class);
        }

        @Test
        @DisplayName("Left-hand table resolves from the preceding Table")
        void testResolveFromTable() {
            Query query = new Query("customers").append(new Join("orders", "id", "=", "customer_id"));

            Join join = (Join) query.lastStage();
            assertThat(join.leftTable()).isEqualTo("customers");
        }

        @Test
        @DisplayName("Left-hand table resolves from the alias of the preceding Join")
        void testResolveFromJoinAlias() {
            Query query = new Query("customers")
                .append(new Join("orders", "id", "=", "customer_id", "inner", "o", null))
                .append(new Join("items", "id", "=", "order_id"));

            Join join = (Join) query.lastStage();
            assertThat(join.leftTable()).isEqualTo("o");
        }

        @Test
        @DisplayName("An explicit left-hand table is kept")
        void testExplicitLeftTable() {
            Query query = new Query("customers")
                .append(new Join("orders", "id", "=", "customer_id"))
                .append(new Join("addresses", "id", "=", "customer_id", "left outer", null, "customers"));

            assertThat(((Join) query.lastStage()).leftTable()).isEqualTo("customers");
        }

        @Test
        @DisplayName("A Join identical to the preceding Join is dropped")
        void testDuplicateJoinDropped() {
            Query query = new Query("customers")
                .append(new Join("orders", "id", "=", "customer_id"))
                .append(new Join("orders", "id", "=", "customer_id"));

            assertThat(query.stages()).hasSize(2);
        }

        @Test
        @DisplayName("Joins differing in any part are both kept")
        void testDifferentJoinsKept() {
            Query query = new Query("customers")
                .append(new Join("orders", "id", "=", "customer_id"))
                .append(new Join("orders", "id", "=", "customer_id", "left outer", null, null));

            assertThat(query.stages()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("Counting")
    class CountRules {

        @Test
        @DisplayName("Projection, Unique, Count fold into one CountUnique")
        void testProjectionUniqueCount() {
            Query query = new Query("people")
                .append(new Projection(List.of("a", "b")))
                .append(new Unique())
                .append(new Count());

            assertThat(query.stages()).hasSize(2);
            assertThat(query.stages().get(0)).isInstanceOf(Table.class);
            CountUnique countUnique = (CountUnique) query.lastStage();
            assertThat(countUnique.columns()).containsExactly(new Column("a"), new Column("b"));
        }

        @Test
        @DisplayName("Unique, Projection, Count does not fold and nests two subqueries")
        void testUniqueProjectionCountDoesNotFold() {
            // Given: the Projection separates Unique from Count
            Query query = new Query("people")
                .append(new Unique())
                .append(new Projection(List.of("a", "b")))
                .append(new Count());

            // When
            String sql = render(query).sql();

            // Then: every stage is kept and each SELECT wraps the previous one
            assertThat(query.stages())
                .extracting(Stage::kind)
                .containsExactly(StageKind.TABLE, StageKind.UNIQUE, StageKind.PROJECTION, StageKind.COUNT);
            assertThat(sql).isEqualTo(
                "SELECT COUNT(*) AS \"count\" FROM " +
                "(SELECT \"a\", \"b\" FROM (SELECT DISTINCT * FROM \"people\") AS tmp) AS tmp");
        }

        @Test
        @DisplayName("Unique, Count without a Projection counts whole rows")
        void testUniqueCount() {
            Query query = new Query("people").append(new Unique()).append(new Count());

            assertThat(query.stages()).hasSize(2);
            assertThat(((CountUnique) query.lastStage()).hasColumns()).isFalse();
        }

        @Test
        @DisplayName("Count without a Unique stays a Count")
        void testPlainCount() {
            Query query = new Query("people")
                .append(new Projection(List.of("a")))
                .append(new Count());

            assertThat(query.stages()).hasSize(3);
            assertThat(query.lastStage()).isInstanceOf(Count.class);
        }

        @Test
        @DisplayName("CountUnique absorbs a directly preceding Projection")
        void testCountUniqueAbsorbsProjection() {
            Query query = new Query("people")
                .append(new Projection(List.of("name")))
                .append(new CountUnique());

            assertThat(query.stages()).hasSize(2);
            assertThat(((CountUnique) query.lastStage()).columns()).containsExactly(new Column("name"));
        }
    }

    @Test
    @DisplayName("Tables are kept most recent first")
    void testTableStack() {
        Query query = new Query("a").append(new Table("b"));

        assertThat(query.tables()).containsExactly("b", "a");
        assertThat(new Query().tables()).isEmpty();
    }

    @Test
    @DisplayName("A query built from a stage list applies the same rules")
    void testConstructFromStages() {
        Query query = new Query(List.of(
            new Table("people"),
            new Projection(List.of("a")),
            new Unique(),
            new Count()));

        assertThat(query.stages()).hasSize(2);
        assertThat(query.lastStage()).isInstanceOf(CountUnique.class);
    }

    @Test
    @DisplayName("The stage list cannot be modified from outside")
    void testStagesUnmodifiable() {
        Query query = new Query("people");

        assertThatThrownBy(() -> query.stages().add(new Unique()))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
