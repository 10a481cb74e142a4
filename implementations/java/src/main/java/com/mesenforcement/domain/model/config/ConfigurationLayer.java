package com.mesenforcement.domain.model.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Partial configuration contributed by one scope. Null fields defer to the next
 * less specific scope.
 */
@Value
@Builder(toBuilder = true)
public class ConfigurationLayer {

    @NonNull
    ScopeLevel level;
    EnforcementMode mode;
    Boolean enforceStatusGating;
    Boolean enforceOperationSequence;
    Boolean enforceQualityChecks;
    Boolean enforceInspectionPass;
    Boolean requireElectronicSig;
    Boolean acceptExternalQuality;
    Boolean qualityRequired;

    /**
     * Fully populated hard defaults: strict mode, every rule enforced, quality required.
     */
    public static ConfigurationLayer systemDefaults(ConfigurationDomain domain) {
        return ConfigurationLayer.builder()
            .level(ScopeLevel.SYSTEM_DEFAULT)
            .mode(domain.strictMode())
            .enforceStatusGating(true)
            .enforceOperationSequence(true)
            .enforceQualityChecks(true)
            .enforceInspectionPass(true)
            .requireElectronicSig(false)
            .acceptExternalQuality(false)
            .qualityRequired(true)
            .build();
    }

    public boolean isComplete() {
        return mode != null
            && enforceStatusGating != null
            && enforceOperationSequence != null
            && enforceQualityChecks != null
            && enforceInspectionPass != null
            && requireElectronicSig != null
            && acceptExternalQuality != null
            && qualityRequired != null;
    }
}
