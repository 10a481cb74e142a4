package com.mesenforcement.application;

import com.mesenforcement.domain.model.DependencyType;
import com.mesenforcement.domain.model.RoutingStep;
import com.mesenforcement.domain.model.RoutingStepDependency;
import com.mesenforcement.domain.model.WorkOrderOperation;
import com.mesenforcement.domain.model.config.WorkflowMode;
import com.mesenforcement.domain.model.decision.PrerequisiteEdge;
import com.mesenforcement.domain.model.decision.PrerequisiteValidation;
import com.mesenforcement.domain.repository.RoutingRepository;
import com.mesenforcement.domain.repository.WorkOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Walks the prerequisite edges of one work order operation.
 *
 * <p>Edges come from the routing step dependencies of the operation's step. An operation
 * without a routing step depends implicitly (SEQUENTIAL) on every sibling with a lower
 * sequence number. Every unmet edge is reported, whatever the mode; the mode only decides
 * whether unmet edges invalidate the result.
 *
 * @since 1.0.0
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class PrerequisiteGraphValidator {

    private final WorkOrderRepository workOrderRepository;
    private final RoutingRepository routingRepository;

    /**
     * Validate the prerequisites of an operation.
     *
     * @param workOrderId Work order that owns the operation
     * @param operationId Operation about to start
     * @param mode STRICT invalidates on any unmet edge, FLEXIBLE and HYBRID tolerate them
     * @return Validation with unmet edges ordered by prerequisite sequence
     * @throws com.mesenforcement.application.exceptions.EnforcementUnavailableException
     *         if a store cannot be read
     */
    public PrerequisiteValidation validatePrerequisites(String workOrderId, String operationId, WorkflowMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");

        if (isBlank(workOrderId) || isBlank(operationId)) {
            return invalid(mode, "Work order ID and operation ID are required");
        }

        return StoreCalls.call("Failed to validate prerequisites", () -> {
            Optional<WorkOrderOperation> found = workOrderRepository.findOperationById(operationId);
            if (found.isEmpty()) {
                return invalid(mode, "Operation " + Encode.forJava(operationId) + " not found");
            }
            WorkOrderOperation operation = found.get();
            if (!operation.belongsTo(workOrderId)) {
                return invalid(mode, "Operation " + Encode.forJava(operationId)
                    + " does not belong to work order " + Encode.forJava(workOrderId));
            }

            List<PrerequisiteEdge> unmet = operation.getRoutingStepId() == null
                ? unmetImplicitPrerequisites(operation)
                : unmetRoutingPrerequisites(operation);
            unmet.sort(Comparator.comparingInt(PrerequisiteEdge::getPrerequisiteOperationSeq));

            return summarize(operation, unmet, mode);
        });
    }

    private List<PrerequisiteEdge> unmetRoutingPrerequisites(WorkOrderOperation operation) {
        Map<String, RoutingStepDependency> byPrerequisiteStep = new LinkedHashMap<>();
        for (RoutingStepDependency dependency : routingRepository.findPrerequisitesOf(operation.getRoutingStepId())) {
            byPrerequisiteStep.putIfAbsent(dependency.getPrerequisiteStepId(), dependency);
        }

        List<PrerequisiteEdge> unmet = new ArrayList<>();
        for (RoutingStepDependency dependency : byPrerequisiteStep.values()) {
            DependencyType type = dependency.getDependencyType();
            String prerequisiteStepId = dependency.getPrerequisiteStepId();

            if (prerequisiteStepId.equals(operation.getRoutingStepId())) {
                unmet.add(edge(operation, operation.getId(), operation.getOperationName(),
                    operation.getSequenceNumber(), type, "Operation depends on itself"));
                continue;
            }
            if (type == DependencyType.PARALLEL) {
                continue;
            }

            Optional<WorkOrderOperation> prerequisite =
                workOrderRepository.findOperationForRoutingStep(operation.getWorkOrderId(), prerequisiteStepId);

            if (prerequisite.isEmpty()) {
                Optional<RoutingStep> step = routingRepository.findStepById(prerequisiteStepId);
                unmet.add(edge(operation, null,
                    step.map(RoutingStep::getOperationName).orElse(prerequisiteStepId),
                    step.map(RoutingStep::getStepNumber).orElse(0),
                    type,
                    "No operation exists for routing step " + prerequisiteStepId));
                continue;
            }

            WorkOrderOperation sibling = prerequisite.get();
            if (!type.isSatisfiedBy(sibling.getStatus())) {
                unmet.add(edge(operation, sibling.getId(), sibling.getOperationName(),
                    sibling.getSequenceNumber(), type, unmetReason(sibling, type)));
            }
        }
        return unmet;
    }

    private List<PrerequisiteEdge> unmetImplicitPrerequisites(WorkOrderOperation operation) {
        List<PrerequisiteEdge> unmet = new ArrayList<>();
        for (WorkOrderOperation sibling : workOrderRepository.findOperationsByWorkOrderId(operation.getWorkOrderId())) {
            if (sibling.getSequenceNumber() >= operation.getSequenceNumber()
                    || sibling.getId().equals(operation.getId())) {
                continue;
            }
            if (!DependencyType.SEQUENTIAL.isSatisfiedBy(sibling.getStatus())) {
                unmet.add(edge(operation, sibling.getId(), sibling.getOperationName(),
                    sibling.getSequenceNumber(), DependencyType.SEQUENTIAL,
                    unmetReason(sibling, DependencyType.SEQUENTIAL)));
            }
        }
        return unmet;
    }

    private PrerequisiteValidation summarize(WorkOrderOperation operation, List<PrerequisiteEdge> unmet, WorkflowMode mode) {
        PrerequisiteValidation.PrerequisiteValidationBuilder result = PrerequisiteValidation.builder()
            .unmetPrerequisites(unmet)
            .enforcementMode(mode);

        if (unmet.isEmpty()) {
            return result.valid(true).build();
        }

        if (log.isInfoEnabled()) {
            log.info("Unmet prerequisites: operationId={}, count={}, mode={}",
                Encode.forJava(operation.getId()), unmet.size(), mode);
        }

        if (!mode.toleratesUnmetPrerequisites()) {
            return result.valid(false).build();
        }

        result.valid(true)
            .warning(unmet.size() + " prerequisite(s) not met, but allowed in " + mode + " mode");
        unmet.forEach(edge -> result.warning(describe(edge)));
        return result.build();
    }

    /**
     * One-line description of an unmet edge, e.g. {@code "Setup (seq 10): Status is CREATED, must be COMPLETED"}.
     */
    static String describe(PrerequisiteEdge edge) {
        return edge.getPrerequisiteOperationName() + " (seq " + edge.getPrerequisiteOperationSeq() + "): " + edge.getReason();
    }

    private static String unmetReason(WorkOrderOperation prerequisite, DependencyType type) {
        return "Status is " + prerequisite.getStatus() + ", must be " + type.requiredStatusDescription();
    }

    private static PrerequisiteEdge edge(
            WorkOrderOperation current,
            String prerequisiteId,
            String prerequisiteName,
            int prerequisiteSeq,
            DependencyType type,
            String reason) {
        return PrerequisiteEdge.builder()
            .prerequisiteOperationId(prerequisiteId)
            .prerequisiteOperationName(prerequisiteName)
            .prerequisiteOperationSeq(prerequisiteSeq)
            .currentOperationSeq(current.getSequenceNumber())
            .dependencyType(type)
            .reason(reason)
            .build();
    }

    private static PrerequisiteValidation invalid(WorkflowMode mode, String reason) {
        return PrerequisiteValidation.builder()
            .valid(false)
            .enforcementMode(mode)
            .reason(reason)
            .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
