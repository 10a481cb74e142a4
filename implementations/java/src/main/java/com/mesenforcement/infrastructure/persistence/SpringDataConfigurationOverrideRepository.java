package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.config.ConfigurationDomain;
import com.mesenforcement.domain.model.config.ConfigurationOverride;
import com.mesenforcement.domain.model.config.ScopeLevel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Spring Data JPA repository for configuration overrides.
 *
 * <p>{@code (domain, scopeLevel, scopeId)} is unique, so at most one row matches.
 */
@Repository
public interface SpringDataConfigurationOverrideRepository extends JpaRepository<ConfigurationOverride, String> {

    Optional<ConfigurationOverride> findByDomainAndScopeLevelAndScopeId(
        ConfigurationDomain domain, ScopeLevel scopeLevel, String scopeId);
}
