package com.stagesql.exception;

import com.stagesql.expression.Predicate;
import com.stagesql.logical.Aggregation;
import com.stagesql.logical.Aggregation.Aggregate;
import com.stagesql.logical.Join;
import com.stagesql.logical.Projection;
import com.stagesql.logical.Query;
import com.stagesql.logical.Table;
import com.stagesql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for error context and user-facing error messages.
 *
 * <p>These tests verify that:
 * <ul>
 *   <li>Exceptions name the stage or input that was rejected</li>
 *   <li>Error messages are user-friendly and actionable</li>
 *   <li>Technical details are available for debugging</li>
 * </ul>
 */
@DisplayName("Error Handling Tests")
@TestCategories.Unit
public class ErrorHandlingTest {

    @Nested
    @DisplayName("SQL Generation Exception Tests")
    class SQLGenerationExceptionTests {

        @Test
        @DisplayName("Exception message includes the stage type")
        void testMessageIncludesStageType() {
            // Given: Failed stage
            Table table = new Table("people");
            SQLGenerationException ex = new SQLGenerationException("Test error", table);

            // Then: Message includes stage type
            assertThat(ex.getMessage()).contains("Test error").contains("Table");
            assertThat(ex.getFailedStage()).isSameAs(table);
        }

        @Test
        @DisplayName("Aggregation after projection reports an actionable message")
        void testAggregationAfterProjectionMessage() {
            // Given
            Query query = new Query("events").append(new Projection(List.of("type")));

            // When
            InvalidQueryException ex = catchThrowableOfType(
                () -> query.append(new Aggregation(List.of(Aggregate.of("count", "*")))),
                InvalidQueryException.class);

            // Then
            assertThat(ex.getFailedStage()).isInstanceOf(Aggregation.class);
            assertThat(ex.getMessage()).contains("Aggregation");
            assertThat(ex.getUserMessage()).contains("aggregation").contains("projection");
        }

        @Test
        @DisplayName("Misplaced join reports the join")
        void testMisplacedJoinMessage() {
            InvalidQueryException ex = catchThrowableOfType(
                () -> new Query().append(new Join("orders", "id", "=", "customer_id")),
                InvalidQueryException.class);

            assertThat(ex.getFailedStage()).isInstanceOf(Join.class);
            assertThat(ex.getUserMessage()).contains("join");
        }

        @Test
        @DisplayName("Missing table has no failed stage")
        void testMissingTableMessage() {
            InvalidQueryException ex = catchThrowableOfType(
                () -> new Query().render("?"), InvalidQueryException.class);

            assertThat(ex.getFailedStage()).isNull();
            assertThat(ex.getMessage()).contains("stage type: none");
            assertThat(ex.getUserMessage()).contains("no table");
        }

        @Test
        @DisplayName("Technical message carries stage and cause")
        void testTechnicalMessage() {
            Table table = new Table("people");
            RuntimeException cause = new IllegalStateException("boom");
            SQLGenerationException ex = new SQLGenerationException("Render failed", cause, table);

            String technical = ex.getTechnicalMessage();

            assertThat(technical)
                .contains("SQL Generation Failed")
                .contains("Render failed")
                .contains(Table.class.getName())
                .contains("Cause: boom");
            assertThat(ex.getCause()).isSameAs(cause);
        }
    }

    @Nested
    @DisplayName("Validation Exception Tests")
    class ValidationExceptionTests {

        @Test
        @DisplayName("Identifier errors carry phase and input")
        void testIdentifierError() {
            InvalidIdentifierException ex = catchThrowableOfType(
                () -> new Table("bad name"), InvalidIdentifierException.class);

            assertThat(ex.getValidationPhase()).isEqualTo("identifier validation");
            assertThat(ex.getInvalidInput()).isEqualTo("bad name");
            assertThat(ex.getUserMessage()).contains("identifier validation").contains("bad name");
        }

        @Test
        @DisplayName("Operator errors carry the rejected operator")
        void testOperatorError() {
            InvalidComparisonOperatorException ex = catchThrowableOfType(
                () -> new Predicate("age", "<", null), InvalidComparisonOperatorException.class);

            assertThat(ex.getValidationPhase()).isEqualTo("operator validation");
            assertThat(ex.getInvalidInput()).isEqualTo("<");
        }

        @Test
        @DisplayName("Join type and aggregate errors name their input")
        void testJoinAndAggregateErrors() {
            InvalidJoinTypeException joinEx = catchThrowableOfType(
                () -> new Join("orders", "id", "=", "id", "natural", null, null), InvalidJoinTypeException.class);
            InvalidAggregateFunctionException aggEx = catchThrowableOfType(
                () -> Aggregate.of("median", "x"), InvalidAggregateFunctionException.class);

            assertThat(joinEx.getInvalidInput()).isEqualTo("natural");
            assertThat(aggEx.getInvalidInput()).isEqualTo("median");
            assertThat(aggEx.getMessage()).contains("Unsupported aggregate function");
        }

        @Test
        @DisplayName("User message without input omits it")
        void testUserMessageWithoutInput() {
            ValidationException ex = new ValidationException("Path cannot be null or empty", "path validation", null);

            assertThat(ex.getUserMessage()).isEqualTo("Query rejected during path validation: Path cannot be null or empty");
        }
    }
}
