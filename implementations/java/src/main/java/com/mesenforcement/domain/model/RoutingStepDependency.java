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
 * Declared edge between two routing steps: the dependent step may not run until the
 * prerequisite step satisfies {@link #dependencyType}.
 *
 * <p>Edges point at routing steps, not at work order operations. The operation
 * instance for a prerequisite step is resolved per work order at validation time.
 */
@Entity
@Immutable
@Table(name = "routing_step_dependencies")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RoutingStepDependency {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "dependent_step_id", nullable = false)
    private String dependentStepId;

    @Column(name = "prerequisite_step_id", nullable = false)
    private String prerequisiteStepId;

    @Enumerated(EnumType.STRING)
    @Column(name = "dependency_type", nullable = false)
    private DependencyType dependencyType;
}
