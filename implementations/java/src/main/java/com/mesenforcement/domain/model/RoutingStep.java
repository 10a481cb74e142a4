package com.mesenforcement.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "routing_steps")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RoutingStep {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "routing_id", nullable = false)
    private String routingId;

    @Column(name = "step_number", nullable = false)
    private int stepNumber;

    @Column(name = "operation_name", nullable = false)
    private String operationName;
}
