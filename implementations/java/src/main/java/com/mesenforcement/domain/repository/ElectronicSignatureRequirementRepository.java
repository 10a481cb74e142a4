package com.mesenforcement.domain.repository;

import com.mesenforcement.domain.model.ElectronicSignatureRequirement;

import java.util.Optional;

public interface ElectronicSignatureRequirementRepository {

    Optional<ElectronicSignatureRequirement> findForSite(String actionType, String siteId);

    /**
     * @param actionType Action type
     * @return The row with a null site, used when a site defines no requirement
     */
    Optional<ElectronicSignatureRequirement> findGlobal(String actionType);
}
