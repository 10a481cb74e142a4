package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.InspectionStatus;
import com.mesenforcement.domain.model.QualityInspection;
import com.mesenforcement.domain.repository.QualityInspectionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class QualityInspectionRepositoryAdapter implements QualityInspectionRepository {

    private final SpringDataQualityInspectionRepository inspections;

    @Override
    public Optional<QualityInspection> findLatestCompleted(String operationId) {
        return inspections.findFirstByOperationIdAndStatusOrderByCompletedAtDesc(operationId, InspectionStatus.COMPLETED);
    }
}
