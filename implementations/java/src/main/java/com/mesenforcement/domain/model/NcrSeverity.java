package com.mesenforcement.domain.model;

/**
 * Severity classes of a nonconformance report (NCR).
 */
public enum NcrSeverity {
    MINOR,
    MAJOR,
    CRITICAL
}
