package com.mesenforcement.domain.repository;

import com.mesenforcement.domain.model.audit.AuditEntry;

import java.util.List;

/**
 * Append-only port onto the enforcement audit store.
 *
 * <p>Entries are never updated or deleted.
 */
public interface AuditEntryRepository {

    /**
     * Persist a new entry.
     *
     * @param entry Entry created by {@link AuditEntry#create}
     * @return The persisted entry with its generated id
     */
    AuditEntry append(AuditEntry entry);

    /**
     * @param workOrderId Work order ID
     * @return Entries of that work order, oldest first
     */
    List<AuditEntry> findByWorkOrderId(String workOrderId);
}
