package com.mesenforcement.application;

import com.mesenforcement.application.exceptions.EnforcementUnavailableException;
import com.mesenforcement.config.PerformanceConfiguration.EnforcementMetrics;
import com.mesenforcement.domain.model.ElectronicSignatureRequirement;
import com.mesenforcement.domain.model.InspectionResult;
import com.mesenforcement.domain.model.InspectionStatus;
import com.mesenforcement.domain.model.NcrDisposition;
import com.mesenforcement.domain.model.NcrDispositionRule;
import com.mesenforcement.domain.model.NcrSeverity;
import com.mesenforcement.domain.model.NcrStatus;
import com.mesenforcement.domain.model.NonConformanceReport;
import com.mesenforcement.domain.model.OperationStatus;
import com.mesenforcement.domain.model.QualityInspection;
import com.mesenforcement.domain.model.SignatureLevel;
import com.mesenforcement.domain.model.WorkOrderStatus;
import com.mesenforcement.domain.model.config.ConfigurationDomain;
import com.mesenforcement.domain.model.config.ConfigurationLayer;
import com.mesenforcement.domain.model.config.QualityMode;
import com.mesenforcement.domain.model.config.ScopeLevel;
import com.mesenforcement.domain.model.decision.DispositionValidation;
import com.mesenforcement.domain.model.decision.EnforcementDecision;
import com.mesenforcement.domain.model.decision.QualityRequirement;
import com.mesenforcement.domain.model.decision.SignatureRequirement;
import com.mesenforcement.domain.repository.ElectronicSignatureRequirementRepository;
import com.mesenforcement.domain.repository.NonConformanceRepository;
import com.mesenforcement.domain.repository.QualityInspectionRepository;
import com.mesenforcement.domain.repository.WorkOrderRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static com.mesenforcement.EnforcementFixtures.SITE_ID;
import static com.mesenforcement.EnforcementFixtures.WORK_ORDER_ID;
import static com.mesenforcement.EnforcementFixtures.operation;
import static com.mesenforcement.EnforcementFixtures.workOrder;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("DefaultQualityGate")
class DefaultQualityGateTest {

    private static final String OPERATION_ID = "op-1";

    private WorkOrderRepository workOrders;
    private QualityInspectionRepository inspections;
    private NonConformanceRepository ncrs;
    private ElectronicSignatureRequirementRepository signatures;
    private FakeConfigurationResolver resolver;
    private DefaultQualityGate gate;

    @BeforeEach
    void setUp() {
        workOrders = mock(WorkOrderRepository.class);
        inspections = mock(QualityInspectionRepository.class);
        ncrs = mock(NonConformanceRepository.class);
        signatures = mock(ElectronicSignatureRequirementRepository.class);
        resolver = new FakeConfigurationResolver();

        when(workOrders.findById(WORK_ORDER_ID)).thenReturn(Optional.of(workOrder(WorkOrderStatus.IN_PROGRESS)));
        when(workOrders.findOperationById(any())).thenReturn(Optional.empty());
        when(workOrders.findOperationById(OPERATION_ID))
            .thenReturn(Optional.of(operation(OPERATION_ID, "step-1", "Machining", 10, OperationStatus.IN_PROGRESS)));
        when(inspections.findLatestCompleted(any())).thenReturn(Optional.empty());
        when(ncrs.findById(any())).thenReturn(Optional.empty());
        when(ncrs.findDispositionRules(any())).thenReturn(List.of());
        when(signatures.findForSite(any(), any())).thenReturn(Optional.empty());
        when(signatures.findGlobal(any())).thenReturn(Optional.empty());

        gate = new DefaultQualityGate(workOrders, inspections, ncrs, signatures, resolver,
            new EnforcementMetrics(new SimpleMeterRegistry()));
    }

    private void quality(ScopeLevel level, QualityMode mode, Boolean qualityRequired) {
        resolver.with(ConfigurationDomain.QUALITY, ConfigurationLayer.builder()
            .level(level)
            .mode(mode)
            .qualityRequired(qualityRequired)
            .build());
    }

    private void latestInspection(InspectionResult result) {
        when(inspections.findLatestCompleted(OPERATION_ID)).thenReturn(Optional.of(QualityInspection.builder()
            .id("insp-1")
            .operationId(OPERATION_ID)
            .result(result)
            .status(InspectionStatus.COMPLETED)
            .completedAt(Instant.parse("2026-03-01T10:00:00Z"))
            .build()));
    }

    @Nested
    @DisplayName("isQualityInspectionRequired")
    class InspectionRequired {

        @Test
        void strictRequires() {
            QualityRequirement requirement = gate.isQualityInspectionRequired(OPERATION_ID);

            assertTrue(requirement.isRequired());
            assertEquals(QualityMode.STRICT, requirement.getMode());
            assertTrue(requirement.getReason().contains("required"));
        }

        @Test
        @DisplayName("an operation-level exemption overrides a STRICT site")
        void operationExemption() {
            quality(ScopeLevel.OPERATION, null, false);
            quality(ScopeLevel.SITE, QualityMode.STRICT, true);

            QualityRequirement requirement = gate.isQualityInspectionRequired(OPERATION_ID);

            assertFalse(requirement.isRequired());
            assertTrue(requirement.isExempt());
            assertEquals(ScopeLevel.OPERATION, requirement.getSource());
            assertEquals(QualityMode.STRICT, requirement.getMode());
        }

        @Test
        void recommendedDoesNotRequire() {
            quality(ScopeLevel.SITE, QualityMode.RECOMMENDED, null);

            QualityRequirement requirement = gate.isQualityInspectionRequired(OPERATION_ID);

            assertFalse(requirement.isRequired());
            assertFalse(requirement.isExempt());
            assertTrue(requirement.getReason().contains("recommended"));
            assertEquals(ScopeLevel.SITE, requirement.getSource());
        }

        @Test
        @DisplayName("EXTERNAL never requires a local inspection")
        void externalNeverRequires() {
            quality(ScopeLevel.SITE, QualityMode.EXTERNAL, true);

            QualityRequirement requirement = gate.isQualityInspectionRequired(OPERATION_ID);

            assertFalse(requirement.isRequired());
            assertTrue(requirement.getReason().contains("external"));
        }

        @Test
        void unknownOperation() {
            QualityRequirement requirement = gate.isQualityInspectionRequired("missing");

            assertFalse(requirement.isRequired());
            assertTrue(requirement.getReason().contains("not found"));
        }
    }

    @Nested
    @DisplayName("canCompleteWithoutPassingInspection")
    class CompleteWithoutPassingInspection {

        @Test
        void strictWithPass() {
            latestInspection(InspectionResult.PASS);

            EnforcementDecision decision = gate.canCompleteWithoutPassingInspection(OPERATION_ID);

            assertTrue(decision.isAllowed());
            assertTrue(decision.getBypassesApplied().isEmpty());
            assertEquals(QualityMode.STRICT, decision.getConfigMode());
        }

        @Test
        void strictWithFail() {
            latestInspection(InspectionResult.FAIL);

            EnforcementDecision decision = gate.canCompleteWithoutPassingInspection(OPERATION_ID);

            assertFalse(decision.isAllowed());
            assertTrue(decision.getReason().contains("failed"));
        }

        @Test
        void strictWithoutInspection() {
            EnforcementDecision decision = gate.canCompleteWithoutPassingInspection(OPERATION_ID);

            assertFalse(decision.isAllowed());
            assertTrue(decision.getReason().contains("not performed"));
        }

        @Test
        @DisplayName("CONDITIONAL is not a pass")
        void strictWithConditional() {
            latestInspection(InspectionResult.CONDITIONAL);

            EnforcementDecision decision = gate.canCompleteWithoutPassingInspection(OPERATION_ID);

            assertFalse(decision.isAllowed());
            assertTrue(decision.getReason().contains("CONDITIONAL"));
        }

        @Test
        @DisplayName("RECOMMENDED with a FAIL inspection is allowed with a bypass")
        void recommendedWithFail() {
            quality(ScopeLevel.SITE, QualityMode.RECOMMENDED, null);
            latestInspection(InspectionResult.FAIL);

            EnforcementDecision decision = gate.canCompleteWithoutPassingInspection(OPERATION_ID);

            assertTrue(decision.isAllowed());
            assertFalse(decision.getWarnings().isEmpty());
            assertEquals(List.of("quality_pass_requirement"), decision.getBypassesApplied());
        }

        @Test
        @DisplayName("STRICT with the pass requirement switched off is allowed with a bypass")
        void strictWithPassNotEnforced() {
            resolver.with(ConfigurationDomain.QUALITY, ConfigurationLayer.builder()
                .level(ScopeLevel.ROUTING).enforceInspectionPass(false).build());

            EnforcementDecision decision = gate.canCompleteWithoutPassingInspection(OPERATION_ID);

            assertTrue(decision.isAllowed());
            assertTrue(decision.getBypassesApplied().contains("quality_pass_requirement"));
            assertTrue(decision.getWarnings().get(0).contains("not performed"));
        }

        @Test
        void unknownOperationDenied() {
            EnforcementDecision decision = gate.canCompleteWithoutPassingInspection("missing");

            assertFalse(decision.isAllowed());
            assertTrue(decision.getReason().contains("not found"));
        }
    }

    @Nested
    @DisplayName("isElectronicSignatureRequired")
    class ElectronicSignature {

        private ElectronicSignatureRequirement row(String siteId, boolean required, SignatureLevel level) {
            return ElectronicSignatureRequirement.builder()
                .id("sig-" + siteId)
                .actionType("COMPLETE_OPERATION")
                .siteId(siteId)
                .requiresSignature(required)
                .signatureLevel(level)
                .build();
        }

        @Test
        @DisplayName("a site row applies without a global row")
        void siteRow() {
            when(signatures.findForSite("COMPLETE_OPERATION", SITE_ID))
                .thenReturn(Optional.of(row(SITE_ID, true, SignatureLevel.SUPERVISOR)));

            SignatureRequirement requirement = gate.isElectronicSignatureRequired("COMPLETE_OPERATION", SITE_ID);

            assertTrue(requirement.isRequired());
            assertEquals(SignatureLevel.SUPERVISOR, requirement.getSignatureLevel());
            assertTrue(requirement.isSiteSpecific());
        }

        @Test
        @DisplayName("a site row wins over the global row")
        void siteBeatsGlobal() {
            when(signatures.findForSite("COMPLETE_OPERATION", SITE_ID))
                .thenReturn(Optional.of(row(SITE_ID, false, null)));
            when(signatures.findGlobal("COMPLETE_OPERATION"))
                .thenReturn(Optional.of(row(null, true, SignatureLevel.QUALITY)));

            assertFalse(gate.isElectronicSignatureRequired("COMPLETE_OPERATION", SITE_ID).isRequired());
        }

        @Test
        void globalFallback() {
            when(signatures.findGlobal("COMPLETE_OPERATION"))
                .thenReturn(Optional.of(row(null, true, SignatureLevel.QUALITY)));

            SignatureRequirement requirement = gate.isElectronicSignatureRequired("COMPLETE_OPERATION", SITE_ID);

            assertTrue(requirement.isRequired());
            assertEquals(SignatureLevel.QUALITY, requirement.getSignatureLevel());
            assertFalse(requirement.isSiteSpecific());
        }

        @Test
        void noRows() {
            assertFalse(gate.isElectronicSignatureRequired("COMPLETE_OPERATION", SITE_ID).isRequired());
        }

        @Test
        void storeFailure() {
            when(signatures.findForSite(any(), any())).thenThrow(new DataAccessResourceFailureException("down"));

            assertThrows(EnforcementUnavailableException.class,
                () -> gate.isElectronicSignatureRequired("COMPLETE_OPERATION", SITE_ID));
        }
    }

    @Nested
    @DisplayName("validateNcrDisposition")
    class NcrDispositions {

        private void ncr(String id, NcrSeverity severity, NcrStatus status) {
            when(ncrs.findById(id)).thenReturn(Optional.of(NonConformanceReport.builder()
                .id(id).siteId(SITE_ID).severity(severity).status(status).build()));
        }

        private NcrDispositionRule rule(String siteId, NcrSeverity severity, EnumSet<NcrDisposition> allowed,
                                        boolean requiresApproval, String approvalLevel) {
            return NcrDispositionRule.builder()
                .id("rule-" + severity + "-" + siteId)
                .siteId(siteId)
                .severity(severity)
                .allowedDispositions(allowed)
                .requiresApproval(requiresApproval)
                .approvalLevel(approvalLevel)
                .build();
        }

        @Test
        @DisplayName("CRITICAL USE_AS_IS without a rule is rejected by the default policy")
        void criticalUseAsIsDefault() {
            ncr("ncr-1", NcrSeverity.CRITICAL, NcrStatus.OPEN);

            DispositionValidation validation = gate.validateNcrDisposition("ncr-1", NcrDisposition.USE_AS_IS);

            assertFalse(validation.isValid());
            assertTrue(validation.getReason().contains("Critical"));
            assertTrue(validation.isDefaultPolicyApplied());
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(value = NcrDisposition.class, names = "USE_AS_IS", mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("CRITICAL without a rule accepts every other disposition")
        void criticalOtherDispositionsDefault(NcrDisposition disposition) {
            ncr("ncr-1", NcrSeverity.CRITICAL, NcrStatus.OPEN);

            DispositionValidation validation = gate.validateNcrDisposition("ncr-1", disposition);

            assertTrue(validation.isValid());
            assertFalse(validation.isRequiresApproval());
        }

        @Test
        void criticalRuleExcludingUseAsIs() {
            ncr("ncr-1", NcrSeverity.CRITICAL, NcrStatus.OPEN);
            when(ncrs.findDispositionRules(NcrSeverity.CRITICAL)).thenReturn(List.of(
                rule(null, NcrSeverity.CRITICAL, EnumSet.of(NcrDisposition.SCRAP, NcrDisposition.REWORK), true, "MRB")));

            DispositionValidation validation = gate.validateNcrDisposition("ncr-1", NcrDisposition.USE_AS_IS);

            assertFalse(validation.isValid());
            assertTrue(validation.getReason().contains("not allowed"));
        }

        @Test
        void minorRuleAllowingUseAsIs() {
            ncr("ncr-2", NcrSeverity.MINOR, NcrStatus.OPEN);
            when(ncrs.findDispositionRules(NcrSeverity.MINOR)).thenReturn(List.of(
                rule(null, NcrSeverity.MINOR, EnumSet.of(NcrDisposition.USE_AS_IS, NcrDisposition.REWORK), false, null)));

            DispositionValidation validation = gate.validateNcrDisposition("ncr-2", NcrDisposition.USE_AS_IS);

            assertTrue(validation.isValid());
            assertFalse(validation.isRequiresApproval());
            assertFalse(validation.isDefaultPolicyApplied());
        }

        @Test
        void majorRuleRequiringApproval() {
            ncr("ncr-3", NcrSeverity.MAJOR, NcrStatus.UNDER_REVIEW);
            when(ncrs.findDispositionRules(NcrSeverity.MAJOR)).thenReturn(List.of(
                rule(null, NcrSeverity.MAJOR, EnumSet.of(NcrDisposition.REPAIR), true, "QUALITY_MANAGER")));

            DispositionValidation validation = gate.validateNcrDisposition("ncr-3", NcrDisposition.REPAIR);

            assertTrue(validation.isValid());
            assertTrue(validation.isRequiresApproval());
            assertEquals("QUALITY_MANAGER", validation.getApprovalLevel());
        }

        @Test
        @DisplayName("a site rule wins over the global rule")
        void siteRuleWins() {
            ncr("ncr-4", NcrSeverity.MAJOR, NcrStatus.OPEN);
            when(ncrs.findDispositionRules(NcrSeverity.MAJOR)).thenReturn(List.of(
                rule(null, NcrSeverity.MAJOR, EnumSet.of(NcrDisposition.USE_AS_IS), false, null),
                rule(SITE_ID, NcrSeverity.MAJOR, EnumSet.of(NcrDisposition.SCRAP), false, null)));

            assertFalse(gate.validateNcrDisposition("ncr-4", NcrDisposition.USE_AS_IS).isValid());
            assertTrue(gate.validateNcrDisposition("ncr-4", NcrDisposition.SCRAP).isValid());
        }

        @Test
        @DisplayName("a rule for another site is ignored")
        void otherSiteRuleIgnored() {
            ncr("ncr-5", NcrSeverity.CRITICAL, NcrStatus.OPEN);
            when(ncrs.findDispositionRules(NcrSeverity.CRITICAL)).thenReturn(List.of(
                rule("site-other", NcrSeverity.CRITICAL, EnumSet.of(NcrDisposition.USE_AS_IS), false, null)));

            DispositionValidation validation = gate.validateNcrDisposition("ncr-5", NcrDisposition.USE_AS_IS);

            assertFalse(validation.isValid());
            assertTrue(validation.isDefaultPolicyApplied());
        }

        @Test
        void closedNcr() {
            ncr("ncr-6", NcrSeverity.MINOR, NcrStatus.CLOSED);

            DispositionValidation validation = gate.validateNcrDisposition("ncr-6", NcrDisposition.SCRAP);

            assertFalse(validation.isValid());
            assertTrue(validation.getReason().contains("CLOSED"));
        }

        @Test
        void unknownNcr() {
            DispositionValidation validation = gate.validateNcrDisposition("ncr-missing", NcrDisposition.SCRAP);

            assertFalse(validation.isValid());
            assertTrue(validation.getReason().contains("not found"));
        }

        @Test
        void nullDispositionIsAProgrammingError() {
            assertThrows(NullPointerException.class, () -> gate.validateNcrDisposition("ncr-1", null));
        }
    }
}
