package com.mesenforcement.domain.repository;

import com.mesenforcement.domain.model.config.ConfigurationDomain;
import com.mesenforcement.domain.model.config.ConfigurationLayer;
import com.mesenforcement.domain.model.config.ScopeLevel;

import java.util.Optional;

/**
 * Read port onto configuration override rows.
 *
 * <p>Workflow and quality overrides are stored and fetched independently.
 */
public interface ConfigurationOverrideRepository {

    /**
     * @param domain Configuration family
     * @param level Scope level of the override
     * @param scopeId Identifier of the site, routing, work order or operation
     * @return The partial override at that scope, empty when the scope defines nothing
     */
    Optional<ConfigurationLayer> findLayer(ConfigurationDomain domain, ScopeLevel level, String scopeId);
}
