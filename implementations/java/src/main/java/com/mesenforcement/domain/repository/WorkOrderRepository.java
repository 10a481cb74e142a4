package com.mesenforcement.domain.repository;

import com.mesenforcement.domain.model.WorkOrder;
import com.mesenforcement.domain.model.WorkOrderOperation;

import java.util.List;
import java.util.Optional;

/**
 * Read port onto the work-order store.
 *
 * <p>The enforcement engine never writes work orders or operations; status changes
 * belong to the state-transition logic that consumes enforcement decisions.
 *
 * <p>Implementations signal store failures with Spring's
 * {@link org.springframework.dao.DataAccessException} hierarchy.
 *
 * @since 1.0.0
 */
public interface WorkOrderRepository {

    /**
     * @param workOrderId Work order ID
     * @return Work order if it exists
     */
    Optional<WorkOrder> findById(String workOrderId);

    /**
     * @param operationId Work order operation ID
     * @return Operation if it exists
     */
    Optional<WorkOrderOperation> findOperationById(String operationId);

    /**
     * Find the operation instance that a work order stamped from a routing step.
     *
     * @param workOrderId Work order ID
     * @param routingStepId Routing step ID
     * @return The operation, empty if the work order has no instance of that step
     */
    Optional<WorkOrderOperation> findOperationForRoutingStep(String workOrderId, String routingStepId);

    /**
     * @param workOrderId Work order ID
     * @return All operations of the work order ordered by sequence number
     */
    List<WorkOrderOperation> findOperationsByWorkOrderId(String workOrderId);
}
