package org.rescueswarm.engine.domain;

/**
 * Malformed event rejected at the ingestion boundary.
 */
public final class ValidationException extends DispatchException {

    public static final String REASON = "VALIDATION_FAILED";

    public ValidationException(String message) {
        super(REASON, message);
    }
}
