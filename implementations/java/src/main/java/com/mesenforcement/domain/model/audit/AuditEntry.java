package com.mesenforcement.domain.model.audit;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only record of one enforcement action and the bypasses applied to it.
 *
 * <p>Rows are inserted once and never updated or deleted. Hibernate ignores updates
 * to {@link Immutable} entities, and no delete path exists in the repository port.
 *
 * @since 1.0.0
 */
@Entity
@Immutable
@Table(
    name = "workflow_enforcement_audit",
    indexes = @Index(name = "idx_enforcement_audit_work_order", columnList = "work_order_id, recorded_at")
)
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class AuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, updatable = false)
    private AuditCategory category;

    @Column(name = "work_order_id", nullable = false, updatable = false)
    private String workOrderId;

    @Column(name = "operation_id", updatable = false)
    private String operationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false)
    private EnforcementAction action;

    @Column(name = "enforcement_mode", nullable = false, updatable = false)
    private String enforcementMode;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "workflow_enforcement_audit_bypasses",
        joinColumns = @JoinColumn(name = "audit_id")
    )
    @OrderColumn(name = "position")
    @Column(name = "bypass_id", nullable = false)
    private List<String> bypassesApplied = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "workflow_enforcement_audit_warnings",
        joinColumns = @JoinColumn(name = "audit_id")
    )
    @OrderColumn(name = "position")
    @Column(name = "warning", nullable = false, length = 1000)
    private List<String> warnings = new ArrayList<>();

    @Column(name = "justification", length = 2000, updatable = false)
    private String justification;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    private AuditEntry(
            AuditCategory category,
            String workOrderId,
            String operationId,
            EnforcementAction action,
            String enforcementMode,
            List<String> bypassesApplied,
            List<String> warnings,
            String justification,
            String userId,
            Instant recordedAt) {

        this.category = Objects.requireNonNull(category, "category must not be null");
        this.workOrderId = Objects.requireNonNull(workOrderId, "workOrderId must not be null");
        this.operationId = operationId;
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.enforcementMode = Objects.requireNonNull(enforcementMode, "enforcementMode must not be null");
        this.bypassesApplied = new ArrayList<>(bypassesApplied);
        this.warnings = new ArrayList<>(warnings);
        this.justification = justification;
        this.userId = Objects.requireNonNull(userId, "userId must not be null");
        this.recordedAt = Objects.requireNonNull(recordedAt, "recordedAt must not be null");
    }

    /**
     * Create a new, not yet persisted entry.
     */
    public static AuditEntry create(
            AuditCategory category,
            String workOrderId,
            String operationId,
            EnforcementAction action,
            String enforcementMode,
            List<String> bypassesApplied,
            List<String> warnings,
            String justification,
            String userId,
            Instant recordedAt) {

        return new AuditEntry(category, workOrderId, operationId, action, enforcementMode,
            bypassesApplied == null ? List.of() : bypassesApplied,
            warnings == null ? List.of() : warnings,
            justification, userId, recordedAt);
    }

    public List<String> getBypassesApplied() {
        return Collections.unmodifiableList(bypassesApplied);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
