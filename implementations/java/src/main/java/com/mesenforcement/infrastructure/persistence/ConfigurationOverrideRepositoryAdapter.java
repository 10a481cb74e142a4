package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.config.ConfigurationDomain;
import com.mesenforcement.domain.model.config.ConfigurationLayer;
import com.mesenforcement.domain.model.config.ConfigurationOverride;
import com.mesenforcement.domain.model.config.ScopeLevel;
import com.mesenforcement.domain.repository.ConfigurationOverrideRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Adapter implementing domain ConfigurationOverrideRepository using Spring Data JPA.
 *
 * <p>Override rows are administered elsewhere and read uncached, so a change takes
 * effect on the next decision.
 */
@Component
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class ConfigurationOverrideRepositoryAdapter implements ConfigurationOverrideRepository {

    private final SpringDataConfigurationOverrideRepository overrides;

    @Override
    public Optional<ConfigurationLayer> findLayer(ConfigurationDomain domain, ScopeLevel level, String scopeId) {
        if (level == ScopeLevel.SYSTEM_DEFAULT) {
            throw new IllegalArgumentException("System defaults come from application configuration, not override rows");
        }

        Optional<ConfigurationOverride> row = overrides.findByDomainAndScopeLevelAndScopeId(domain, level, scopeId);

        if (row.isPresent() && log.isDebugEnabled()) {
            log.debug("Configuration override found: domain={}, level={}, scopeId={}", domain, level, scopeId);
        }
        return row.map(ConfigurationOverride::toLayer);
    }
}
