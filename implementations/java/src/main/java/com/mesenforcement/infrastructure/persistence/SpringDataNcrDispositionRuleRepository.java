package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.NcrDispositionRule;
import com.mesenforcement.domain.model.NcrSeverity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SpringDataNcrDispositionRuleRepository extends JpaRepository<NcrDispositionRule, String> {

    List<NcrDispositionRule> findBySeverityOrderByIdAsc(NcrSeverity severity);
}
