package com.mesenforcement.domain.model;

/**
 * Lifecycle states of a work order operation.
 *
 * <p>The enforcement engine only authorizes CREATED to IN_PROGRESS (start) and
 * IN_PROGRESS to COMPLETED (complete).
 */
public enum OperationStatus {
    CREATED,
    IN_PROGRESS,
    ON_HOLD,
    COMPLETED,
    CANCELLED
}
