package com.mesenforcement.domain.model.audit;

public enum AuditCategory {
    /** Workflow rule bypassed or enforced on a work order / operation transition. */
    ENFORCEMENT_BYPASS,
    /** Quality-gate decision acted upon (inspection, signature, disposition). */
    QUALITY_ENFORCEMENT
}
