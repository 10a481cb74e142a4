package com.mesenforcement.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

@Entity
@Immutable
@Table(name = "quality_inspections")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QualityInspection {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "operation_id", nullable = false)
    private String operationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "result")
    private InspectionResult result;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private InspectionStatus status;

    @Column(name = "completed_at")
    private Instant completedAt;

    public boolean isPassed() {
        return result == InspectionResult.PASS;
    }
}
