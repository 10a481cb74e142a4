package com.mesenforcement.application;

import com.mesenforcement.config.PerformanceConfiguration.EnforcementMetrics;
import com.mesenforcement.domain.model.OperationStatus;
import com.mesenforcement.domain.model.WorkOrder;
import com.mesenforcement.domain.model.WorkOrderOperation;
import com.mesenforcement.domain.model.WorkOrderStatus;
import com.mesenforcement.domain.model.config.ConfigurationDomain;
import com.mesenforcement.domain.model.config.ConfigurationScope;
import com.mesenforcement.domain.model.config.EffectiveConfiguration;
import com.mesenforcement.domain.model.config.WorkflowMode;
import com.mesenforcement.domain.model.decision.BypassType;
import com.mesenforcement.domain.model.decision.EnforcementDecision;
import com.mesenforcement.domain.model.decision.PrerequisiteValidation;
import com.mesenforcement.domain.model.decision.QualityRequirement;
import com.mesenforcement.domain.model.decision.StatusValidation;
import com.mesenforcement.domain.repository.WorkOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Workflow policy combinator.
 *
 * <p>Answers whether performance may be recorded against a work order and whether an
 * operation may start or complete. Each call resolves the effective WORKFLOW
 * configuration, evaluates its checks in a fixed order and returns one
 * {@link EnforcementDecision}.
 *
 * <p><strong>Hard checks</strong> (operation status, existence, ownership) block in every
 * mode and never produce bypasses. <strong>Soft checks</strong> (status gating, operation
 * sequence, quality checks) block only when the mode enforces their {@code enforce*} flag; otherwise
 * they are bypassed with a warning, and the caller is expected to record the bypass
 * through the audit recorder.
 *
 * @since 1.0.0
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class EnforcementDecisionEngine {

    static final String STATUS_GATING = BypassType.STATUS_GATING.checkName();
    static final String OPERATION_STATUS = "Operation Status";
    static final String OPERATION_SEQUENCE = BypassType.OPERATION_SEQUENCE.checkName();

    /** Reported by decisions rejected before any configuration could be resolved. */
    static final WorkflowMode UNRESOLVED_MODE = WorkflowMode.STRICT;

    private final WorkOrderRepository workOrderRepository;
    private final ConfigurationResolver configurationResolver;
    private final PrerequisiteGraphValidator prerequisiteGraphValidator;
    private final QualityGate qualityGate;
    private final EnforcementMetrics metrics;

    /**
     * Can production performance be recorded against the work order?
     *
     * @param workOrderId Work order ID
     * @return Allowed when the work order is IN_PROGRESS, or when status gating is not enforced
     */
    public EnforcementDecision canRecordPerformance(String workOrderId) {
        EnforcementChecklist checklist = new EnforcementChecklist();

        if (isBlank(workOrderId)) {
            return checklist.deny("Work order ID is required", UNRESOLVED_MODE);
        }

        Optional<WorkOrder> found = StoreCalls.call(
            "Failed to check if performance can be recorded",
            () -> workOrderRepository.findById(workOrderId));
        if (found.isEmpty()) {
            return checklist.deny("Work order " + Encode.forJava(workOrderId) + " not found", UNRESOLVED_MODE);
        }
        WorkOrder workOrder = found.get();

        EffectiveConfiguration config = configurationResolver.resolve(
            ConfigurationDomain.WORKFLOW, ConfigurationScope.of(workOrder));
        WorkflowMode mode = config.getWorkflowMode();
        boolean gatingEnforced = mode.enforces(config.isEnforceStatusGating());

        EnforcementDecision decision;
        if (workOrder.getStatus() == WorkOrderStatus.IN_PROGRESS) {
            checklist.soft(STATUS_GATING, gatingEnforced, true);
            decision = checklist.allow(mode);
        } else if (gatingEnforced) {
            checklist.soft(STATUS_GATING, true, false);
            decision = checklist.deny("Work order status is " + workOrder.getStatus()
                + ", must be " + WorkOrderStatus.IN_PROGRESS + " to record performance", mode);
        } else {
            checklist.bypass(BypassType.STATUS_GATING, List.of("Work order status is " + workOrder.getStatus()
                + ", recording performance outside " + WorkOrderStatus.IN_PROGRESS + " in " + mode + " mode"));
            decision = checklist.allow(mode);
        }

        return finish("record_performance", workOrderId, null, decision);
    }

    /**
     * Can the operation be started?
     *
     * @param workOrderId Work order ID
     * @param operationId Operation ID, must belong to the work order
     * @return Denied unless the operation is CREATED; prerequisites checked per mode
     */
    public EnforcementDecision canStartOperation(String workOrderId, String operationId) {
        EnforcementChecklist checklist = new EnforcementChecklist();

        Optional<String> missing = requireIds(workOrderId, operationId);
        if (missing.isPresent()) {
            return checklist.deny(missing.get(), UNRESOLVED_MODE);
        }

        Lookup lookup = lookup(workOrderId, operationId, "Failed to check if operation can be started");
        if (lookup.rejection() != null) {
            return finish("start_operation", workOrderId, operationId, checklist.deny(lookup.rejection(), UNRESOLVED_MODE));
        }

        EffectiveConfiguration config = configurationResolver.resolve(
            ConfigurationDomain.WORKFLOW, ConfigurationScope.of(lookup.workOrder(), lookup.operation()));
        WorkflowMode mode = config.getWorkflowMode();

        OperationStatus status = lookup.operation().getStatus();
        if (!checklist.hard(OPERATION_STATUS, status == OperationStatus.CREATED)) {
            return finish("start_operation", workOrderId, operationId,
                checklist.deny(startRejection(status), mode));
        }

        boolean sequenceEnforced = mode.enforces(config.isEnforceOperationSequence());
        PrerequisiteValidation prerequisites = prerequisiteGraphValidator.validatePrerequisites(
            workOrderId, operationId, WorkflowMode.forSequencing(sequenceEnforced, mode));

        EnforcementDecision decision;
        if (!prerequisites.hasUnmetPrerequisites()) {
            checklist.soft(OPERATION_SEQUENCE, sequenceEnforced, true);
            decision = checklist.allow(mode);
        } else if (!prerequisites.isValid()) {
            checklist.soft(OPERATION_SEQUENCE, true, false);
            decision = checklist.deny("Unmet prerequisites: " + prerequisites.getUnmetPrerequisites().stream()
                .map(PrerequisiteGraphValidator::describe)
                .collect(Collectors.joining("; ")), mode);
        } else {
            checklist.bypass(BypassType.OPERATION_SEQUENCE, prerequisites.getWarnings());
            decision = checklist.allow(mode);
        }

        return finish("start_operation", workOrderId, operationId, decision);
    }

    /**
     * Can the operation be completed?
     *
     * <p>When the workflow mode enforces quality checks and the operation is not exempt from
     * inspection, the quality gate's decision is folded into this one: a quality denial denies
     * completion, a tolerated inspection problem becomes a {@code quality_pass_requirement}
     * bypass. The returned {@code configMode} is the WORKFLOW mode; the quality mode that
     * tolerated or denied the inspection is named in the folded warning or reason.
     *
     * @param workOrderId Work order ID
     * @param operationId Operation ID, must belong to the work order
     * @return Denied unless the operation is IN_PROGRESS and the quality gate is satisfied
     */
    public EnforcementDecision canCompleteOperation(String workOrderId, String operationId) {
        EnforcementChecklist checklist = new EnforcementChecklist();

        Optional<String> missing = requireIds(workOrderId, operationId);
        if (missing.isPresent()) {
            return checklist.deny(missing.get(), UNRESOLVED_MODE);
        }

        Lookup lookup = lookup(workOrderId, operationId, "Failed to check if operation can be completed");
        if (lookup.rejection() != null) {
            return finish("complete_operation", workOrderId, operationId, checklist.deny(lookup.rejection(), UNRESOLVED_MODE));
        }

        EffectiveConfiguration config = configurationResolver.resolve(
            ConfigurationDomain.WORKFLOW, ConfigurationScope.of(lookup.workOrder(), lookup.operation()));
        WorkflowMode mode = config.getWorkflowMode();

        OperationStatus status = lookup.operation().getStatus();
        if (!checklist.hard(OPERATION_STATUS, status == OperationStatus.IN_PROGRESS)) {
            return finish("complete_operation", workOrderId, operationId, checklist.deny(
                "Operation status is " + status + ", must be " + OperationStatus.IN_PROGRESS + " to complete", mode));
        }

        if (mode.enforces(config.isEnforceQualityChecks())) {
            QualityRequirement requirement = qualityGate.isQualityInspectionRequired(operationId);
            if (!requirement.isExempt()) {
                EnforcementDecision quality = qualityGate.canCompleteWithoutPassingInspection(operationId);
                checklist.include(quality);
                if (quality.isDenied()) {
                    return finish("complete_operation", workOrderId, operationId,
                        checklist.deny(quality.getReason(), mode));
                }
            }
        }

        return finish("complete_operation", workOrderId, operationId, checklist.allow(mode));
    }

    /**
     * Check a work order's status against a caller-supplied set.
     *
     * @param workOrderId Work order ID
     * @param allowedStatuses Statuses that make the work order valid
     * @return Validation carrying the current status when the work order exists
     */
    public StatusValidation validateWorkOrderStatus(String workOrderId, Set<WorkOrderStatus> allowedStatuses) {
        Objects.requireNonNull(allowedStatuses, "allowedStatuses must not be null");

        if (isBlank(workOrderId)) {
            return new StatusValidation(false, null, "Work order ID is required");
        }

        Optional<WorkOrder> found = StoreCalls.call(
            "Failed to validate work order status",
            () -> workOrderRepository.findById(workOrderId));
        if (found.isEmpty()) {
            return new StatusValidation(false, null, "Work order " + Encode.forJava(workOrderId) + " not found");
        }

        WorkOrderStatus current = found.get().getStatus();
        if (allowedStatuses.contains(current)) {
            return new StatusValidation(true, current, null);
        }
        return new StatusValidation(false, current, "Work order status is " + current
            + ", must be one of " + allowedStatuses.stream().map(Enum::name).sorted().collect(Collectors.joining(", ")));
    }

    /**
     * @param workOrderId Work order ID
     * @return Effective WORKFLOW configuration at work order scope, empty if the work order does not exist
     */
    public Optional<EffectiveConfiguration> getEffectiveConfiguration(String workOrderId) {
        if (isBlank(workOrderId)) {
            return Optional.empty();
        }
        return StoreCalls.call("Failed to load work order configuration",
                () -> workOrderRepository.findById(workOrderId))
            .map(workOrder -> configurationResolver.resolve(ConfigurationDomain.WORKFLOW, ConfigurationScope.of(workOrder)));
    }

    private Lookup lookup(String workOrderId, String operationId, String failureMessage) {
        return StoreCalls.call(failureMessage, () -> {
            Optional<WorkOrderOperation> operation = workOrderRepository.findOperationById(operationId);
            if (operation.isEmpty()) {
                return Lookup.rejected("Operation " + Encode.forJava(operationId) + " not found");
            }
            if (!operation.get().belongsTo(workOrderId)) {
                return Lookup.rejected("Operation " + Encode.forJava(operationId)
                    + " does not belong to work order " + Encode.forJava(workOrderId));
            }
            return workOrderRepository.findById(workOrderId)
                .map(workOrder -> new Lookup(workOrder, operation.get(), null))
                .orElseGet(() -> Lookup.rejected("Work order " + Encode.forJava(workOrderId) + " not found"));
        });
    }

    private static String startRejection(OperationStatus status) {
        if (status == OperationStatus.IN_PROGRESS || status == OperationStatus.COMPLETED) {
            return "Operation is already " + status;
        }
        return "Operation status is " + status + ", must be " + OperationStatus.CREATED + " to start";
    }

    private EnforcementDecision finish(String operation, String workOrderId, String operationId, EnforcementDecision decision) {
        metrics.recordDecision(operation, decision);

        if (decision.isDenied()) {
            if (log.isInfoEnabled()) {
                log.info("Enforcement denied: operation={}, workOrderId={}, operationId={}, mode={}, reason={}",
                    operation, Encode.forJava(workOrderId), operationId == null ? null : Encode.forJava(operationId),
                    decision.getConfigMode(), decision.getReason());
            }
        } else if (decision.hasBypasses()) {
            log.warn("Enforcement bypassed: operation={}, workOrderId={}, operationId={}, mode={}, bypasses={}",
                operation, Encode.forJava(workOrderId), operationId == null ? null : Encode.forJava(operationId),
                decision.getConfigMode(), decision.getBypassesApplied());
        }
        return decision;
    }

    private static Optional<String> requireIds(String workOrderId, String operationId) {
        if (isBlank(workOrderId)) {
            return Optional.of("Work order ID is required");
        }
        if (isBlank(operationId)) {
            return Optional.of("Operation ID is required");
        }
        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Lookup(WorkOrder workOrder, WorkOrderOperation operation, String rejection) {

        static Lookup rejected(String reason) {
            return new Lookup(null, null, reason);
        }
    }
}
