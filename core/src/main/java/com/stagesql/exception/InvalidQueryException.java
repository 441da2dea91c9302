package com.stagesql.exception;

import com.stagesql.logical.Stage;

/**
 * Structural error in a stage sequence.
 *
 * <p>Raised when:
 * <ul>
 *   <li>an Aggregation is appended after a Projection</li>
 *   <li>a Join is appended without a preceding Table or Join</li>
 *   <li>a query without any Table stage is rendered</li>
 * </ul>
 */
public class InvalidQueryException extends SQLGenerationException {

    public InvalidQueryException(String message, Stage stage) {
        super(message, stage);
    }

    public InvalidQueryException(String message) {
        super(message, null);
    }
}
