package com.mesenforcement.domain.model.config;

/**
 * Policy tier for quality rules (inspections, inspection pass, signatures).
 */
public enum QualityMode implements EnforcementMode {

    /** Inspection required and must pass. */
    STRICT,

    /** Inspection expected; a missing or failed inspection is a warning. */
    RECOMMENDED,

    OPTIONAL,

    /** Quality evidence is accepted from an outside system instead of local inspections. */
    EXTERNAL;

    @Override
    public ConfigurationDomain domain() {
        return ConfigurationDomain.QUALITY;
    }

    @Override
    public boolean isStrict() {
        return this == STRICT;
    }

    /**
     * Only STRICT blocks; the other modes downgrade a failed quality check to a warning.
     */
    @Override
    public boolean enforces(boolean flag) {
        return this == STRICT && flag;
    }
}
