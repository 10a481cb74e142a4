package com.mesenforcement.infrastructure.audit;

import com.mesenforcement.domain.model.audit.AuditEntry;
import com.mesenforcement.domain.model.audit.EnforcementAction;
import com.mesenforcement.domain.model.decision.EnforcementDecision;

import java.util.List;
import java.util.Optional;

/**
 * Append-only trail of enforcement actions.
 *
 * <p>Recording never changes a decision already handed to the caller: a failed write is
 * logged and reported as an empty result.
 */
public interface AuditRecorder {

    /**
     * Record a workflow action, typically one that carried bypasses.
     *
     * @param workOrderId Work order ID
     * @param operationId Operation ID, null for work-order level actions
     * @param action Action that was performed
     * @param decision Decision the action relied on
     * @param userId User who performed the action
     * @return The stored entry, empty if the write failed
     */
    Optional<AuditEntry> recordEnforcementBypass(
        String workOrderId, String operationId, EnforcementAction action, EnforcementDecision decision, String userId);

    /**
     * Same as {@link #recordEnforcementBypass(String, String, EnforcementAction, EnforcementDecision, String)}
     * with an operator-supplied justification.
     */
    Optional<AuditEntry> recordEnforcementBypass(
        String workOrderId, String operationId, EnforcementAction action, EnforcementDecision decision,
        String userId, String justification);

    Optional<AuditEntry> recordQualityEnforcementAction(
        String workOrderId, String operationId, EnforcementAction action, EnforcementDecision decision, String userId);

    Optional<AuditEntry> recordQualityEnforcementAction(
        String workOrderId, String operationId, EnforcementAction action, EnforcementDecision decision,
        String userId, String justification);

    /**
     * @param workOrderId Work order ID
     * @return Entries of the work order, oldest first
     */
    List<AuditEntry> getAuditTrail(String workOrderId);
}
