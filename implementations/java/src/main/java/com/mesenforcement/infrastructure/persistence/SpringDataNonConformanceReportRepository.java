package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.NonConformanceReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SpringDataNonConformanceReportRepository extends JpaRepository<NonConformanceReport, String> {
}
