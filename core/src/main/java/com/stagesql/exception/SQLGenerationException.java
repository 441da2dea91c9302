package com.stagesql.exception;

import com.stagesql.logical.Stage;

/**
 * Exception thrown when a stage sequence cannot be turned into SQL.
 *
 * <p>This exception carries the stage that triggered the failure (if any) so
 * that callers can report which part of the pipeline was at fault.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       RenderedSQL rendered = query.render("?");
 *   } catch (SQLGenerationException e) {
 *       log.warn(e.getUserMessage());
 *       log.debug(e.getTechnicalMessage());
 *   }
 * </pre>
 *
 * @see InvalidQueryException
 */
public class SQLGenerationException extends RuntimeException {

    private final Stage failedStage;

    /**
     * Creates a SQL generation exception.
     *
     * @param message the error message
     * @param stage the stage that failed, may be null
     */
    public SQLGenerationException(String message, Stage stage) {
        super(message + " (stage type: " + (stage != null ? stage.getClass().getSimpleName() : "none") + ")");
        this.failedStage = stage;
    }

    /**
     * Creates a SQL generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param stage the stage that failed, may be null
     */
    public SQLGenerationException(String message, Throwable cause, Stage stage) {
        super(message + " (stage type: " + (stage != null ? stage.getClass().getSimpleName() : "none") + ")", cause);
        this.failedStage = stage;
    }

    /**
     * Returns the stage that failed.
     *
     * @return the failed stage, or null if not available
     */
    public Stage getFailedStage() {
        return failedStage;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        if (failedStage == null) {
            return "Failed to generate SQL: the query has no table. " +
                   "Start the query with a Table stage.";
        }

        switch (failedStage.kind()) {
            case AGGREGATION:
                return "Failed to add aggregation: aggregates cannot follow a projection. " +
                       "Aggregate first, or drop the projection.";
            case JOIN:
                return "Failed to add join: a join must directly follow a table or another join.";
            default:
                return "Failed to generate SQL for stage " + failedStage.kind() + ".";
        }
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("SQL Generation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedStage != null) {
            sb.append("Failed Stage Type: ").append(failedStage.getClass().getName()).append("\n");
            sb.append("Stage String: ").append(failedStage).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
