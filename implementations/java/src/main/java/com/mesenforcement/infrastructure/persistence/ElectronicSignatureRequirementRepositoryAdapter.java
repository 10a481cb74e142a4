package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.config.CacheConfiguration;
import com.mesenforcement.domain.model.ElectronicSignatureRequirement;
import com.mesenforcement.domain.repository.ElectronicSignatureRequirementRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class ElectronicSignatureRequirementRepositoryAdapter implements ElectronicSignatureRequirementRepository {

    private final SpringDataSignatureRequirementRepository requirements;

    @Override
    // Key joins actionType and siteId (SpEL uses #root.args to avoid param-name reliance)
    @Cacheable(value = CacheConfiguration.SITE_SIGNATURE_REQUIREMENTS, key = "#root.args[0] + '|' + #root.args[1]")
    public Optional<ElectronicSignatureRequirement> findForSite(String actionType, String siteId) {
        return requirements.findFirstByActionTypeAndSiteId(actionType, siteId);
    }

    @Override
    @Cacheable(value = CacheConfiguration.GLOBAL_SIGNATURE_REQUIREMENTS, key = "#root.args[0]")
    public Optional<ElectronicSignatureRequirement> findGlobal(String actionType) {
        return requirements.findFirstByActionTypeAndSiteIdIsNull(actionType);
    }
}
