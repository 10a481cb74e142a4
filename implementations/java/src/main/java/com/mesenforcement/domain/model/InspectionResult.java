package com.mesenforcement.domain.model;

/**
 * Overall result of a quality inspection.
 */
public enum InspectionResult {
    PASS,
    FAIL,
    CONDITIONAL
}
