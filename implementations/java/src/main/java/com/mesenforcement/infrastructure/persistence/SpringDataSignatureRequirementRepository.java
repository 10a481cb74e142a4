package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.ElectronicSignatureRequirement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SpringDataSignatureRequirementRepository extends JpaRepository<ElectronicSignatureRequirement, String> {

    Optional<ElectronicSignatureRequirement> findFirstByActionTypeAndSiteId(String actionType, String siteId);

    /**
     * @param actionType Action type
     * @return The global row (null site) for the action type
     */
    Optional<ElectronicSignatureRequirement> findFirstByActionTypeAndSiteIdIsNull(String actionType);
}
