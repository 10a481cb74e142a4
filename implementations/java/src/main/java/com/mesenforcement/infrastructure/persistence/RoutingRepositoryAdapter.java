package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.RoutingStep;
import com.mesenforcement.domain.model.RoutingStepDependency;
import com.mesenforcement.domain.repository.RoutingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class RoutingRepositoryAdapter implements RoutingRepository {

    private final SpringDataRoutingStepRepository steps;
    private final SpringDataRoutingStepDependencyRepository dependencies;

    @Override
    public Optional<RoutingStep> findStepById(String routingStepId) {
        return steps.findById(routingStepId);
    }

    @Override
    public List<RoutingStepDependency> findPrerequisitesOf(String dependentStepId) {
        return dependencies.findByDependentStepIdOrderByIdAsc(dependentStepId);
    }
}
