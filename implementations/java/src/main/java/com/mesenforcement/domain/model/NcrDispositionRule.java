package com.mesenforcement.domain.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Administratively configured disposition policy for one NCR severity.
 *
 * <p>A rule with a null {@code siteId} is global; site rules take precedence.
 */
@Entity
@Immutable
@Table(name = "ncr_disposition_rules")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NcrDispositionRule {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "site_id")
    private String siteId;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false)
    private NcrSeverity severity;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "ncr_disposition_rule_allowed",
        joinColumns = @JoinColumn(name = "rule_id")
    )
    @Enumerated(EnumType.STRING)
    @Column(name = "disposition")
    private Set<NcrDisposition> allowedDispositions;

    @Column(name = "requires_approval", nullable = false)
    private boolean requiresApproval;

    @Column(name = "approval_level")
    private String approvalLevel;

    public boolean allows(NcrDisposition disposition) {
        return allowedDispositions != null && allowedDispositions.contains(disposition);
    }

    public boolean isGlobal() {
        return siteId == null;
    }

    public Set<NcrDisposition> getAllowedDispositions() {
        return allowedDispositions == null || allowedDispositions.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(allowedDispositions));
    }
}
