package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.WorkOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data JPA repository for work orders. Read-only from this engine's side.
 */
@Repository
public interface SpringDataWorkOrderRepository extends JpaRepository<WorkOrder, String> {
}
