package com.mesenforcement.domain.repository;

import com.mesenforcement.domain.model.RoutingStep;
import com.mesenforcement.domain.model.RoutingStepDependency;

import java.util.List;
import java.util.Optional;

/**
 * Read port onto routing steps and their declared dependency edges.
 */
public interface RoutingRepository {

    Optional<RoutingStep> findStepById(String routingStepId);

    /**
     * @param dependentStepId Routing step whose prerequisites are requested
     * @return Edges whose dependent step is {@code dependentStepId}
     */
    List<RoutingStepDependency> findPrerequisitesOf(String dependentStepId);
}
