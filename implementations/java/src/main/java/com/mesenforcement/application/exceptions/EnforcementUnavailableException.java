package com.mesenforcement.application.exceptions;

/**
 * A store the enforcement engine depends on could not answer.
 *
 * <p>Raised instead of a decision: the caller chooses its own fail-open or fail-closed
 * policy. Business outcomes (not found, unmet prerequisite, failed inspection) are never
 * reported through this exception.
 */
public class EnforcementUnavailableException extends RuntimeException {

    public EnforcementUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
