package com.mesenforcement.domain.repository;

import com.mesenforcement.domain.model.NcrDispositionRule;
import com.mesenforcement.domain.model.NcrSeverity;
import com.mesenforcement.domain.model.NonConformanceReport;

import java.util.List;
import java.util.Optional;

/**
 * Read port onto nonconformance reports and their configured disposition rules.
 */
public interface NonConformanceRepository {

    Optional<NonConformanceReport> findById(String ncrId);

    /**
     * @param severity NCR severity
     * @return Site-specific and global rules configured for the severity
     */
    List<NcrDispositionRule> findDispositionRules(NcrSeverity severity);
}
