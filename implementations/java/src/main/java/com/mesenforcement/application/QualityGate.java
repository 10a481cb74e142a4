package com.mesenforcement.application;

import com.mesenforcement.domain.model.NcrDisposition;
import com.mesenforcement.domain.model.decision.DispositionValidation;
import com.mesenforcement.domain.model.decision.EnforcementDecision;
import com.mesenforcement.domain.model.decision.QualityRequirement;
import com.mesenforcement.domain.model.decision.SignatureRequirement;

/**
 * Quality-specific enforcement questions.
 *
 * <p>Answers are computed from the effective QUALITY configuration of the operation and
 * from administratively configured rule rows. No method throws for a missing entity;
 * store failures surface as
 * {@link com.mesenforcement.application.exceptions.EnforcementUnavailableException}.
 */
public interface QualityGate {

    /**
     * @param operationId Work order operation ID
     * @return Whether an inspection is required and which scope decided it
     */
    QualityRequirement isQualityInspectionRequired(String operationId);

    /**
     * Decide whether an operation may complete given its latest completed inspection.
     *
     * @param operationId Work order operation ID
     * @return Denied in STRICT mode unless the inspection passed; otherwise allowed,
     *         with a {@code quality_pass_requirement} bypass when it did not pass
     */
    EnforcementDecision canCompleteWithoutPassingInspection(String operationId);

    /**
     * @param actionType Action about to be performed, e.g. {@code COMPLETE_OPERATION}
     * @param siteId Site of the action, null to consult the global row only
     * @return The site row if present, else the global row, else not required
     */
    SignatureRequirement isElectronicSignatureRequired(String actionType, String siteId);

    /**
     * @param ncrId Nonconformance report ID
     * @param proposedDisposition Disposition about to be set
     * @return Legality of the disposition and the approval it needs
     */
    DispositionValidation validateNcrDisposition(String ncrId, NcrDisposition proposedDisposition);
}
