package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.WorkOrder;
import com.mesenforcement.domain.model.WorkOrderOperation;
import com.mesenforcement.domain.repository.WorkOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Adapter implementing domain WorkOrderRepository using Spring Data JPA.
 *
 * <p>Work order state is never cached: every decision reads the current status.
 */
@Component
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class WorkOrderRepositoryAdapter implements WorkOrderRepository {

    private final SpringDataWorkOrderRepository workOrders;
    private final SpringDataWorkOrderOperationRepository operations;

    @Override
    public Optional<WorkOrder> findById(String workOrderId) {
        Optional<WorkOrder> result = workOrders.findById(workOrderId);

        if (result.isEmpty() && log.isDebugEnabled()) {
            log.debug("Work order not found: id={}", workOrderId);
        }
        return result;
    }

    @Override
    public Optional<WorkOrderOperation> findOperationById(String operationId) {
        Optional<WorkOrderOperation> result = operations.findById(operationId);

        if (result.isEmpty() && log.isDebugEnabled()) {
            log.debug("Operation not found: id={}", operationId);
        }
        return result;
    }

    @Override
    public Optional<WorkOrderOperation> findOperationForRoutingStep(String workOrderId, String routingStepId) {
        return operations.findFirstByWorkOrderIdAndRoutingStepIdOrderBySequenceNumberAsc(workOrderId, routingStepId);
    }

    @Override
    public List<WorkOrderOperation> findOperationsByWorkOrderId(String workOrderId) {
        return operations.findByWorkOrderIdOrderBySequenceNumberAsc(workOrderId);
    }
}
