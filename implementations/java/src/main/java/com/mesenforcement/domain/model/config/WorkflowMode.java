package com.mesenforcement.domain.model.config;

/**
 * Policy tier for workflow rules (status gating, operation sequencing).
 */
public enum WorkflowMode implements EnforcementMode {

    /** Unmet prerequisites block the start of an operation. */
    STRICT,

    /** Every soft rule may be bypassed with a warning. */
    FLEXIBLE,

    /** Individual {@code enforce*} flags decide; unmet prerequisites are tolerated. */
    HYBRID;

    @Override
    public ConfigurationDomain domain() {
        return ConfigurationDomain.WORKFLOW;
    }

    @Override
    public boolean isStrict() {
        return this == STRICT;
    }

    /**
     * FLEXIBLE never blocks on a soft check; STRICT and HYBRID follow the flag.
     */
    @Override
    public boolean enforces(boolean flag) {
        return this != FLEXIBLE && flag;
    }

    public boolean toleratesUnmetPrerequisites() {
        return this != STRICT;
    }

    /**
     * Mode under which prerequisites are validated for a start request.
     *
     * <p>An enforced sequence is always validated strictly. A relaxed sequence is
     * validated in the configured mode, except that a relaxed STRICT configuration
     * (site is strict, a lower scope switched sequencing off) is validated as HYBRID.
     */
    public static WorkflowMode forSequencing(boolean sequenceEnforced, WorkflowMode configured) {
        if (sequenceEnforced) {
            return STRICT;
        }
        return configured == STRICT ? HYBRID : configured;
    }
}
