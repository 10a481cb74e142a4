package com.mesenforcement.application;

import com.mesenforcement.config.PerformanceConfiguration.EnforcementMetrics;
import com.mesenforcement.domain.model.ElectronicSignatureRequirement;
import com.mesenforcement.domain.model.InspectionResult;
import com.mesenforcement.domain.model.NcrDisposition;
import com.mesenforcement.domain.model.NcrDispositionRule;
import com.mesenforcement.domain.model.NcrSeverity;
import com.mesenforcement.domain.model.NonConformanceReport;
import com.mesenforcement.domain.model.QualityInspection;
import com.mesenforcement.domain.model.WorkOrder;
import com.mesenforcement.domain.model.WorkOrderOperation;
import com.mesenforcement.domain.model.config.ConfigurationDomain;
import com.mesenforcement.domain.model.config.ConfigurationScope;
import com.mesenforcement.domain.model.config.EffectiveConfiguration;
import com.mesenforcement.domain.model.config.QualityMode;
import com.mesenforcement.domain.model.decision.BypassType;
import com.mesenforcement.domain.model.decision.DispositionValidation;
import com.mesenforcement.domain.model.decision.EnforcementDecision;
import com.mesenforcement.domain.model.decision.QualityRequirement;
import com.mesenforcement.domain.model.decision.SignatureRequirement;
import com.mesenforcement.domain.repository.ElectronicSignatureRequirementRepository;
import com.mesenforcement.domain.repository.NonConformanceRepository;
import com.mesenforcement.domain.repository.QualityInspectionRepository;
import com.mesenforcement.domain.repository.WorkOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link QualityGate} backed by the work order, inspection, NCR and signature stores.
 *
 * @since 1.0.0
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class DefaultQualityGate implements QualityGate {

    static final String INSPECTION_PASS = BypassType.QUALITY_PASS_REQUIREMENT.checkName();

    private final WorkOrderRepository workOrderRepository;
    private final QualityInspectionRepository inspectionRepository;
    private final NonConformanceRepository nonConformanceRepository;
    private final ElectronicSignatureRequirementRepository signatureRepository;
    private final ConfigurationResolver configurationResolver;
    private final EnforcementMetrics metrics;

    @Override
    public QualityRequirement isQualityInspectionRequired(String operationId) {
        if (isBlank(operationId)) {
            return QualityRequirement.builder().required(false).reason("Operation ID is required").build();
        }

        Optional<ScopedOperation> scoped = loadOperation(operationId);
        if (scoped.isEmpty()) {
            return QualityRequirement.builder()
                .required(false)
                .reason("Operation " + Encode.forJava(operationId) + " not found")
                .build();
        }

        EffectiveConfiguration config = qualityConfiguration(scoped.get());
        QualityMode mode = config.getQualityMode();
        QualityRequirement.QualityRequirementBuilder requirement = QualityRequirement.builder().mode(mode);

        if (!config.isQualityRequired()) {
            return requirement
                .required(false)
                .exempt(true)
                .reason("Quality inspection exempted at " + config.getSource().getQualityRequiredSource() + " scope")
                .source(config.getSource().getQualityRequiredSource())
                .build();
        }

        requirement.source(config.getSource().getModeSource());
        return switch (mode) {
            case STRICT -> requirement.required(true)
                .reason("Quality inspection required in STRICT mode").build();
            case RECOMMENDED -> requirement.required(false)
                .reason("Quality inspection recommended but not required").build();
            case OPTIONAL -> requirement.required(false)
                .reason("Quality inspection optional").build();
            case EXTERNAL -> requirement.required(false)
                .reason("Quality is verified by an external system").build();
        };
    }

    @Override
    public EnforcementDecision canCompleteWithoutPassingInspection(String operationId) {
        EnforcementChecklist checklist = new EnforcementChecklist();

        if (isBlank(operationId)) {
            return checklist.deny("Operation ID is required", QualityMode.STRICT);
        }

        Optional<ScopedOperation> scoped = loadOperation(operationId);
        if (scoped.isEmpty()) {
            return checklist.deny("Operation " + Encode.forJava(operationId) + " not found", QualityMode.STRICT);
        }

        EffectiveConfiguration config = qualityConfiguration(scoped.get());
        QualityMode mode = config.getQualityMode();
        boolean enforced = mode.enforces(config.isEnforceInspectionPass());

        Optional<QualityInspection> inspection = StoreCalls.call(
            "Failed to load latest inspection",
            () -> inspectionRepository.findLatestCompleted(operationId));

        EnforcementDecision decision;
        if (inspection.isPresent() && inspection.get().isPassed()) {
            checklist.soft(INSPECTION_PASS, enforced, true);
            decision = checklist.allow(mode);
        } else {
            String problem = describeMissingPass(inspection);

            if (enforced) {
                checklist.soft(INSPECTION_PASS, true, false);
                decision = checklist.deny(problem + "; a passing inspection is required in " + mode + " mode", mode);
            } else {
                checklist.bypass(BypassType.QUALITY_PASS_REQUIREMENT,
                    List.of(problem + ", completion allowed in " + mode + " mode"));
                decision = checklist.allow(mode);
            }
        }

        metrics.recordDecision("complete_without_passing_inspection", decision);
        return decision;
    }

    @Override
    public SignatureRequirement isElectronicSignatureRequired(String actionType, String siteId) {
        Objects.requireNonNull(actionType, "actionType must not be null");

        return StoreCalls.call("Failed to load electronic signature requirement", () -> {
            if (siteId != null) {
                Optional<ElectronicSignatureRequirement> siteRow = signatureRepository.findForSite(actionType, siteId);
                if (siteRow.isPresent()) {
                    return toRequirement(siteRow.get(), true);
                }
            }
            return signatureRepository.findGlobal(actionType)
                .map(globalRow -> toRequirement(globalRow, false))
                .orElseGet(SignatureRequirement::notRequired);
        });
    }

    @Override
    public DispositionValidation validateNcrDisposition(String ncrId, NcrDisposition proposedDisposition) {
        Objects.requireNonNull(proposedDisposition, "proposedDisposition must not be null");

        if (isBlank(ncrId)) {
            return DispositionValidation.builder().valid(false).reason("NCR ID is required").build();
        }

        return StoreCalls.call("Failed to validate NCR disposition", () -> {
            Optional<NonConformanceReport> found = nonConformanceRepository.findById(ncrId);
            if (found.isEmpty()) {
                return DispositionValidation.builder()
                    .valid(false)
                    .reason("NCR " + Encode.forJava(ncrId) + " not found")
                    .build();
            }
            NonConformanceReport ncr = found.get();
            if (ncr.isClosed()) {
                return DispositionValidation.builder()
                    .valid(false)
                    .reason("NCR " + Encode.forJava(ncrId) + " is CLOSED and cannot receive a disposition")
                    .build();
            }

            Optional<NcrDispositionRule> rule = selectRule(ncr, nonConformanceRepository.findDispositionRules(ncr.getSeverity()));
            DispositionValidation validation = rule
                .map(configured -> applyRule(configured, ncr.getSeverity(), proposedDisposition))
                .orElseGet(() -> applyDefaultPolicy(ncr.getSeverity(), proposedDisposition));

            if (!validation.isValid() && log.isInfoEnabled()) {
                log.info("NCR disposition rejected: ncrId={}, severity={}, disposition={}, defaultPolicy={}",
                    Encode.forJava(ncrId), ncr.getSeverity(), proposedDisposition, validation.isDefaultPolicyApplied());
            }
            return validation;
        });
    }

    private static String describeMissingPass(Optional<QualityInspection> inspection) {
        if (inspection.isEmpty()) {
            return "Quality inspection not performed";
        }
        InspectionResult result = inspection.get().getResult();
        if (result == InspectionResult.FAIL) {
            return "Quality inspection failed";
        }
        return "Quality inspection result is " + result + ", not PASS";
    }

    /**
     * Site rule first, then the global rule.
     */
    private static Optional<NcrDispositionRule> selectRule(NonConformanceReport ncr, List<NcrDispositionRule> rules) {
        if (ncr.getSiteId() != null) {
            Optional<NcrDispositionRule> siteRule = rules.stream()
                .filter(rule -> ncr.getSiteId().equals(rule.getSiteId()))
                .findFirst();
            if (siteRule.isPresent()) {
                return siteRule;
            }
        }
        return rules.stream().filter(NcrDispositionRule::isGlobal).findFirst();
    }

    private static DispositionValidation applyRule(NcrDispositionRule rule, NcrSeverity severity, NcrDisposition proposed) {
        if (!rule.allows(proposed)) {
            return DispositionValidation.builder()
                .valid(false)
                .reason("Disposition " + proposed + " is not allowed for " + severity + " NCRs")
                .build();
        }
        return DispositionValidation.builder()
            .valid(true)
            .requiresApproval(rule.isRequiresApproval())
            .approvalLevel(rule.getApprovalLevel())
            .build();
    }

    private static DispositionValidation applyDefaultPolicy(NcrSeverity severity, NcrDisposition proposed) {
        if (severity == NcrSeverity.CRITICAL && proposed == NcrDisposition.USE_AS_IS) {
            return DispositionValidation.builder()
                .valid(false)
                .reason("Critical NCRs cannot be dispositioned as USE_AS_IS")
                .defaultPolicyApplied(true)
                .build();
        }
        return DispositionValidation.builder()
            .valid(true)
            .defaultPolicyApplied(true)
            .build();
    }

    private static SignatureRequirement toRequirement(ElectronicSignatureRequirement row, boolean siteSpecific) {
        return new SignatureRequirement(row.isRequiresSignature(), row.getSignatureLevel(), siteSpecific);
    }

    private Optional<ScopedOperation> loadOperation(String operationId) {
        return StoreCalls.call("Failed to load operation for quality enforcement", () ->
            workOrderRepository.findOperationById(operationId)
                .flatMap(operation -> workOrderRepository.findById(operation.getWorkOrderId())
                    .map(workOrder -> new ScopedOperation(workOrder, operation))));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private EffectiveConfiguration qualityConfiguration(ScopedOperation scoped) {
        return configurationResolver.resolve(ConfigurationDomain.QUALITY,
            ConfigurationScope.of(scoped.workOrder(), scoped.operation()));
    }

    private record ScopedOperation(WorkOrder workOrder, WorkOrderOperation operation) {
    }
}
