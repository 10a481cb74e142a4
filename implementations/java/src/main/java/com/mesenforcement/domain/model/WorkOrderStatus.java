package com.mesenforcement.domain.model;

/**
 * Lifecycle states of a work order as held by the work-order store.
 */
public enum WorkOrderStatus {
    CREATED,
    RELEASED,
    IN_PROGRESS,
    ON_HOLD,
    COMPLETED,
    CANCELLED
}
