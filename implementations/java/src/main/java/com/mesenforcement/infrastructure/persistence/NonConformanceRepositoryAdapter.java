package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.config.CacheConfiguration;
import com.mesenforcement.domain.model.NcrDispositionRule;
import com.mesenforcement.domain.model.NcrSeverity;
import com.mesenforcement.domain.model.NonConformanceReport;
import com.mesenforcement.domain.repository.NonConformanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Adapter implementing domain NonConformanceRepository using Spring Data JPA.
 *
 * <p>NCRs are read fresh; disposition rules are cached per severity.
 */
@Component
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class NonConformanceRepositoryAdapter implements NonConformanceRepository {

    private final SpringDataNonConformanceReportRepository reports;
    private final SpringDataNcrDispositionRuleRepository rules;

    @Override
    public Optional<NonConformanceReport> findById(String ncrId) {
        return reports.findById(ncrId);
    }

    @Override
    @Cacheable(value = CacheConfiguration.NCR_DISPOSITION_RULES, key = "#root.args[0]")
    public List<NcrDispositionRule> findDispositionRules(NcrSeverity severity) {
        List<NcrDispositionRule> result = rules.findBySeverityOrderByIdAsc(severity);

        if (log.isDebugEnabled()) {
            log.debug("Loaded NCR disposition rules: severity={}, count={}", severity, result.size());
        }
        return List.copyOf(result);
    }
}
