package com.mesenforcement.domain.model.decision;

import lombok.Builder;
import lombok.Value;

/**
 * Legality of a proposed NCR disposition and the approval it needs.
 */
@Value
@Builder
public class DispositionValidation {
    boolean valid;
    String reason;
    boolean requiresApproval;
    String approvalLevel;

    /** True when no rule was configured and the built-in policy decided. */
    boolean defaultPolicyApplied;
}
