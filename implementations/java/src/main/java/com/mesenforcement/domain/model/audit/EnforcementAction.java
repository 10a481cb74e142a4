package com.mesenforcement.domain.model.audit;

/**
 * State-changing actions whose enforcement outcome is audited.
 */
public enum EnforcementAction {
    RECORD_PERFORMANCE,
    START_OPERATION,
    COMPLETE_OPERATION,
    COMPLETE_WITHOUT_PASSING_INSPECTION,
    SET_NCR_DISPOSITION,
    APPLY_ELECTRONIC_SIGNATURE
}
