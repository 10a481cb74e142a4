package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.WorkOrderOperation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SpringDataWorkOrderOperationRepository extends JpaRepository<WorkOrderOperation, String> {

    /**
     * Find the operation a work order stamped from a routing step.
     *
     * @param workOrderId Work order ID
     * @param routingStepId Routing step ID
     * @return Lowest-sequence operation of that step, if any
     */
    Optional<WorkOrderOperation> findFirstByWorkOrderIdAndRoutingStepIdOrderBySequenceNumberAsc(
        String workOrderId, String routingStepId);

    List<WorkOrderOperation> findByWorkOrderIdOrderBySequenceNumberAsc(String workOrderId);
}
