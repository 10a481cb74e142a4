package com.mesenforcement.application;

import com.mesenforcement.domain.model.config.ConfigurationDomain;
import com.mesenforcement.domain.model.config.ConfigurationScope;
import com.mesenforcement.domain.model.config.EffectiveConfiguration;

/**
 * Produces the effective configuration for one decision request.
 *
 * <p>Precedence: operation, work order, routing, site, system default. Missing scopes
 * are not errors; fields nobody overrides fall back to the system defaults.
 */
public interface ConfigurationResolver {

    /**
     * @param domain Configuration family to resolve
     * @param scope Scope identifiers of the request, site always present
     * @return Fully populated configuration with provenance
     * @throws com.mesenforcement.application.exceptions.EnforcementUnavailableException
     *         if the override store cannot be read
     */
    EffectiveConfiguration resolve(ConfigurationDomain domain, ConfigurationScope scope);
}
