package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.RoutingStepDependency;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SpringDataRoutingStepDependencyRepository extends JpaRepository<RoutingStepDependency, String> {

    /**
     * @param dependentStepId Routing step whose prerequisites are requested
     * @return Declared edges ordered by id
     */
    List<RoutingStepDependency> findByDependentStepIdOrderByIdAsc(String dependentStepId);
}
