package com.mesenforcement.infrastructure.audit;

import com.mesenforcement.application.exceptions.EnforcementUnavailableException;
import com.mesenforcement.config.PerformanceConfiguration.EnforcementMetrics;
import com.mesenforcement.domain.model.audit.AuditCategory;
import com.mesenforcement.domain.model.audit.AuditEntry;
import com.mesenforcement.domain.model.audit.EnforcementAction;
import com.mesenforcement.domain.model.decision.EnforcementDecision;
import com.mesenforcement.domain.repository.AuditEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultAuditRecorder implements AuditRecorder {

    private final AuditEntryRepository auditEntryRepository;
    private final EnforcementMetrics metrics;
    private final Clock clock;

    @Override
    public Optional<AuditEntry> recordEnforcementBypass(
            String workOrderId, String operationId, EnforcementAction action, EnforcementDecision decision, String userId) {
        return record(AuditCategory.ENFORCEMENT_BYPASS, workOrderId, operationId, action, decision, userId, null);
    }

    @Override
    public Optional<AuditEntry> recordEnforcementBypass(
            String workOrderId, String operationId, EnforcementAction action, EnforcementDecision decision,
            String userId, String justification) {
        return record(AuditCategory.ENFORCEMENT_BYPASS, workOrderId, operationId, action, decision, userId, justification);
    }

    @Override
    public Optional<AuditEntry> recordQualityEnforcementAction(
            String workOrderId, String operationId, EnforcementAction action, EnforcementDecision decision, String userId) {
        return record(AuditCategory.QUALITY_ENFORCEMENT, workOrderId, operationId, action, decision, userId, null);
    }

    @Override
    public Optional<AuditEntry> recordQualityEnforcementAction(
            String workOrderId, String operationId, EnforcementAction action, EnforcementDecision decision,
            String userId, String justification) {
        return record(AuditCategory.QUALITY_ENFORCEMENT, workOrderId, operationId, action, decision, userId, justification);
    }

    @Override
    public List<AuditEntry> getAuditTrail(String workOrderId) {
        Objects.requireNonNull(workOrderId, "workOrderId must not be null");
        try {
            return auditEntryRepository.findByWorkOrderId(workOrderId);
        } catch (DataAccessException e) {
            throw new EnforcementUnavailableException("Failed to load audit trail", e);
        }
    }

    private Optional<AuditEntry> record(
            AuditCategory category,
            String workOrderId,
            String operationId,
            EnforcementAction action,
            EnforcementDecision decision,
            String userId,
            String justification) {

        Objects.requireNonNull(decision, "decision must not be null");
        Objects.requireNonNull(decision.getConfigMode(), "decision carries no enforcement mode");

        AuditEntry entry = AuditEntry.create(
            category,
            workOrderId,
            operationId,
            action,
            decision.getConfigMode().name(),
            decision.getBypassesApplied(),
            decision.getWarnings(),
            justification,
            userId,
            Instant.now(clock)
        );

        log.info("AUDIT category={} action={} workOrderId={} operationId={} mode={} bypasses={} user={}",
            category, action, Encode.forJava(workOrderId),
            operationId == null ? null : Encode.forJava(operationId),
            entry.getEnforcementMode(), entry.getBypassesApplied(), Encode.forJava(userId));

        try {
            AuditEntry stored = auditEntryRepository.append(entry);
            metrics.recordAuditWrite(category.name(), true);
            return Optional.of(stored);
        } catch (DataAccessException | TransactionException e) {
            metrics.recordAuditWrite(category.name(), false);
            log.error("Failed to persist audit entry: category={}, action={}, workOrderId={}",
                category, action, Encode.forJava(workOrderId), e);
            return Optional.empty();
        }
    }
}
