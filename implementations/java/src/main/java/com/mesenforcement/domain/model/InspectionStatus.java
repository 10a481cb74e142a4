package com.mesenforcement.domain.model;

public enum InspectionStatus {
    PLANNED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
