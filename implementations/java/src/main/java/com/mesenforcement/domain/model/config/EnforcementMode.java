package com.mesenforcement.domain.model.config;

/**
 * Common view over the workflow and quality mode enumerations.
 *
 * <p>Decisions and audit entries carry whichever mode was active without caring which
 * configuration domain produced it.
 */
public interface EnforcementMode {

    String name();

    ConfigurationDomain domain();

    boolean isStrict();

    /**
     * Whether a soft check guarded by {@code flag} blocks under this mode.
     */
    boolean enforces(boolean flag);
}
