package com.mesenforcement.domain.model.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Fully merged, read-only policy record used for exactly one decision.
 *
 * <p>Never persisted; recomputed for each request.
 */
@Value
@Builder
public class EffectiveConfiguration {

    @NonNull
    ConfigurationDomain domain;
    @NonNull
    EnforcementMode mode;
    boolean enforceStatusGating;
    boolean enforceOperationSequence;
    boolean enforceQualityChecks;
    boolean enforceInspectionPass;
    boolean requireElectronicSig;
    boolean acceptExternalQuality;
    boolean qualityRequired;
    @NonNull
    ConfigurationSource source;

    public WorkflowMode getWorkflowMode() {
        if (!(mode instanceof WorkflowMode)) {
            throw new IllegalStateException("Configuration of domain " + domain + " carries no workflow mode");
        }
        return (WorkflowMode) mode;
    }

    public QualityMode getQualityMode() {
        if (!(mode instanceof QualityMode)) {
            throw new IllegalStateException("Configuration of domain " + domain + " carries no quality mode");
        }
        return (QualityMode) mode;
    }
}
