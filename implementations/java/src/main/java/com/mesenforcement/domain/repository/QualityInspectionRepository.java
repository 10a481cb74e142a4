package com.mesenforcement.domain.repository;

import com.mesenforcement.domain.model.QualityInspection;

import java.util.Optional;

public interface QualityInspectionRepository {

    /**
     * @param operationId Work order operation ID
     * @return The most recently completed inspection of the operation
     */
    Optional<QualityInspection> findLatestCompleted(String operationId);
}
