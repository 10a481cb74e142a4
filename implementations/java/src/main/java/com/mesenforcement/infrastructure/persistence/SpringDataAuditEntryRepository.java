package com.mesenforcement.infrastructure.persistence;

import com.mesenforcement.domain.model.audit.AuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for audit entries.
 *
 * <p>Only {@code save} of new entries and reads are used; see {@link AuditEntryRepositoryAdapter}.
 */
@Repository
public interface SpringDataAuditEntryRepository extends JpaRepository<AuditEntry, Long> {

    /**
     * Ties on {@code recordedAt} are broken by insertion order.
     */
    List<AuditEntry> findByWorkOrderIdOrderByRecordedAtAscIdAsc(String workOrderId);
}
