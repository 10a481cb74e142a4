package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.audit.AuditEntry;
import com.mesenforcement.domain.repository.AuditEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Adapter implementing domain AuditEntryRepository using Spring Data JPA.
 *
 * <p>Each append runs in its own transaction, so a failed audit write cannot mark the
 * caller's transaction rollback-only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditEntryRepositoryAdapter implements AuditEntryRepository {

    private final SpringDataAuditEntryRepository auditEntries;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditEntry append(AuditEntry entry) {
        if (entry.getId() != null) {
            throw new IllegalArgumentException("Audit entry " + entry.getId() + " is already stored");
        }

        AuditEntry stored = auditEntries.save(entry);

        if (log.isDebugEnabled()) {
            log.debug("Audit entry persisted: id={}, category={}", stored.getId(), stored.getCategory());
        }
        return stored;
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditEntry> findByWorkOrderId(String workOrderId) {
        return auditEntries.findByWorkOrderIdOrderByRecordedAtAscIdAsc(workOrderId);
    }
}
