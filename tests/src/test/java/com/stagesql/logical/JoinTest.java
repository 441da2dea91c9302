package com.stagesql.logical;

import com.stagesql.exception.InvalidComparisonOperatorException;
import com.stagesql.exception.InvalidIdentifierException;
import com.stagesql.exception.InvalidJoinTypeException;
import com.stagesql.expression.Predicate;
import com.stagesql.generator.RenderedSQL;
import com.stagesql.test.TestBase;
import com.stagesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for join construction and rendering.
 */
@DisplayName("Join Tests")
@TestCategories.Unit
public class JoinTest extends TestBase {

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Inner join on a column comparison")
        void testInnerJoin() {
            // Given
            Query query = new Query("customers").append(new Join("orders", "id", "=", "customer_id"));

            // When
            RenderedSQL rendered = render(query);

            // Then
            assertThat(rendered.sql()).isEqualTo(
                "SELECT * FROM \"customers\" INNER JOIN \"orders\" " +
                "ON \"customers\".\"id\" = \"orders\".\"customer_id\"");
            assertThat(rendered.values()).isEmpty();
        }

        @Test
        @DisplayName("Aliased left outer join references the alias")
        void testAliasedLeftOuterJoin() {
            Query query = new Query("customers")
                .append(new Join("orders", "id", "=", "customer_id", "LEFT OUTER", "o", null));

            assertThat(render(query).sql()).isEqualTo(
                "SELECT * FROM \"customers\" LEFT OUTER JOIN \"orders\" AS \"o\" " +
                "ON \"customers\".\"id\" = \"o\".\"customer_id\"");
        }

        @Test
        @DisplayName("Chained joins resolve against the previous join")
        void testChainedJoins() {
            Query query = new Query("customers")
                .append(new Join("orders", "id", "=", "customer_id", "inner", "o", null))
                .append(new Join("items", "id", "=", "order_id"));

            assertThat(render(query).sql()).isEqualTo(
                "SELECT * FROM \"customers\" " +
                "INNER JOIN \"orders\" AS \"o\" ON \"customers\".\"id\" = \"o\".\"customer_id\" " +
                "INNER JOIN \"items\" ON \"o\".\"id\" = \"items\".\"order_id\"");
        }

        @Test
        @DisplayName("Two identical joins render one JOIN clause")
        void testDuplicateJoinRendersOnce() {
            Query query = new Query("customers")
                .append(new Join("orders", "id", "=", "customer_id"))
                .append(new Join("orders", "id", "=", "customer_id"));

            String sql = render(query).sql();
            assertThat(sql.split("JOIN", -1)).hasSize(2);
        }

        @Test
        @DisplayName("Predicate join binds values before later filters")
        void testPredicateJoin() {
            Query query = new Query("customers")
                .append(new Join("orders", List.of(
                    new Predicate("status", "=", "open"),
                    new Predicate("total", ">", 100))))
                .append(new Filter(List.of(new Predicate("country", "=", "NZ"))));

            RenderedSQL rendered = render(query);

            assertThat(rendered.sql()).isEqualTo(
                "SELECT * FROM \"customers\" INNER JOIN \"orders\" " +
                "ON (\"status\" = ?) AND (\"total\" > ?) WHERE (\"country\" = ?)");
            assertThat(rendered.values()).containsExactly("open", 100, "NZ");
        }

        @Test
        @DisplayName("Cross join has no condition")
        void testCrossJoin() {
            Query query = new Query("people").append(Join.cross("dates", "d"));

            assertThat(render(query).sql()).isEqualTo("SELECT * FROM \"people\" CROSS JOIN \"dates\" AS \"d\"");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest
        @CsvSource({
            "inner, INNER",
            "OUTER, OUTER",
            "left outer, LEFT_OUTER",
            "'  Left   Outer ', LEFT_OUTER",
            "cross, CROSS"
        })
        @DisplayName("Join types parse case- and whitespace-insensitively")
        void testJoinTypeParsing(String how, JoinType expected) {
            assertThat(JoinType.fromName(how)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Unsupported join types are rejected")
        void testUnsupportedJoinType() {
            assertThatThrownBy(() -> new Join("orders", "id", "=", "customer_id", "FULL", null, null))
                .isInstanceOf(InvalidJoinTypeException.class)
                .hasMessageContaining("FULL");
        }

        @Test
        @DisplayName("A CROSS join cannot carry a condition")
        void testCrossWithCondition() {
            assertThatThrownBy(() -> new Join("orders", "id", "=", "customer_id", "CROSS", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CROSS");
        }

        @Test
        @DisplayName("Join conditions need a binary operator")
        void testNonBinaryOperator() {
            assertThatThrownBy(() -> new Join("orders", "id", "IN", "customer_id"))
                .isInstanceOf(InvalidComparisonOperatorException.class);
        }

        @Test
        @DisplayName("Table, alias and left-hand table are validated")
        void testNamesValidated() {
            assertThatThrownBy(() -> new Join("orders o", "id", "=", "customer_id"))
                .isInstanceOf(InvalidIdentifierException.class);
            assertThatThrownBy(() -> new Join("orders", "id", "=", "customer_id", "inner", "o;", null))
                .isInstanceOf(InvalidIdentifierException.class);
            assertThatThrownBy(() -> new Join("orders", "id", "=", "customer_id", "inner", null, "c--"))
                .isInstanceOf(InvalidIdentifierException.class);
        }

        @Test
        @DisplayName("A predicate join needs at least one predicate")
        void testEmptyPredicates() {
            assertThatThrownBy(() -> new Join("orders", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Rendering an unresolved join outside a query fails")
        void testUnresolvedJoin() {
            Join join = new Join("orders", "id", "=", "customer_id");

            assertThatThrownBy(() -> join.toSQL("?"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("never resolved");
        }
    }
}
