package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.InspectionStatus;
import com.mesenforcement.domain.model.QualityInspection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SpringDataQualityInspectionRepository extends JpaRepository<QualityInspection, String> {

    Optional<QualityInspection> findFirstByOperationIdAndStatusOrderByCompletedAtDesc(
        String operationId, InspectionStatus status);
}
