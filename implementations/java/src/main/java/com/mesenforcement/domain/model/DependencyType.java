package com.mesenforcement.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kind of prerequisite relation between two routing steps.
 *
 * <p>Each type names the prerequisite operation states that satisfy it.
 */
public enum DependencyType {

    /** Classic finish-to-start sequencing. */
    SEQUENTIAL(EnumSet.of(OperationStatus.COMPLETED)),

    MUST_COMPLETE(EnumSet.of(OperationStatus.COMPLETED)),

    /** Prerequisite must have been started; it may still be running. */
    MUST_START(EnumSet.of(OperationStatus.IN_PROGRESS, OperationStatus.COMPLETED)),

    OVERLAP_ALLOWED(EnumSet.of(OperationStatus.IN_PROGRESS, OperationStatus.COMPLETED)),

    /** No ordering constraint at all. */
    PARALLEL(EnumSet.allOf(OperationStatus.class));

    private final Set<OperationStatus> satisfyingStatuses;

    DependencyType(Set<OperationStatus> satisfyingStatuses) {
        this.satisfyingStatuses = satisfyingStatuses;
    }

    public boolean isSatisfiedBy(OperationStatus prerequisiteStatus) {
        return prerequisiteStatus != null && satisfyingStatuses.contains(prerequisiteStatus);
    }

    /**
     * Human readable form of the required state, used in unmet-prerequisite reasons.
     */
    public String requiredStatusDescription() {
        if (this == PARALLEL) {
            return "any status";
        }
        return satisfyingStatuses.size() == 1
            ? satisfyingStatuses.iterator().next().name()
            : "IN_PROGRESS or COMPLETED";
    }
}
