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

/**
 * Concrete operation instance of a work order.
 *
 * <p>Each instance is stamped from a routing step; {@code routingStepId} is null for
 * operations added outside the routing, in which case sequencing falls back to
 * {@code sequenceNumber}.
 *
 * @since 1.0.0
 */
@Entity
@Immutable
@Table(name = "work_order_operations")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WorkOrderOperation {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "work_order_id", nullable = false)
    private String workOrderId;

    @Column(name = "routing_step_id")
    private String routingStepId;

    @Column(name = "operation_name", nullable = false)
    private String operationName;

    @Column(name = "sequence_number", nullable = false)
    private int sequenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private OperationStatus status;

    public boolean belongsTo(String otherWorkOrderId) {
        return workOrderId != null && workOrderId.equals(otherWorkOrderId);
    }
}
