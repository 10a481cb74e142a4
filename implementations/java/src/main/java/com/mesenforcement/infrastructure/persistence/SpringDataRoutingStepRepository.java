package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.RoutingStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SpringDataRoutingStepRepository extends JpaRepository<RoutingStep, String> {
}
