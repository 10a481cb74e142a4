package com.mesenforcement.domain.model.config;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Persisted override row for one {@code (domain, scopeLevel, scopeId)}.
 *
 * <p>Administered outside this engine. Every policy column is nullable: null means
 * "not overridden at this scope".
 */
@Entity
@Immutable
@Table(
    name = "enforcement_configuration_overrides",
    uniqueConstraints = @UniqueConstraint(columnNames = {"domain", "scope_level", "scope_id"})
)
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConfigurationOverride {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "domain", nullable = false)
    private ConfigurationDomain domain;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope_level", nullable = false)
    private ScopeLevel scopeLevel;

    @Column(name = "scope_id", nullable = false)
    private String scopeId;

    @Column(name = "mode")
    private String mode;

    @Column(name = "enforce_status_gating")
    private Boolean enforceStatusGating;

    @Column(name = "enforce_operation_sequence")
    private Boolean enforceOperationSequence;

    @Column(name = "enforce_quality_checks")
    private Boolean enforceQualityChecks;

    @Column(name = "enforce_inspection_pass")
    private Boolean enforceInspectionPass;

    @Column(name = "require_electronic_sig")
    private Boolean requireElectronicSig;

    @Column(name = "accept_external_quality")
    private Boolean acceptExternalQuality;

    @Column(name = "quality_required")
    private Boolean qualityRequired;

    public ConfigurationLayer toLayer() {
        return ConfigurationLayer.builder()
            .level(scopeLevel)
            .mode(domain.parseMode(mode))
            .enforceStatusGating(enforceStatusGating)
            .enforceOperationSequence(enforceOperationSequence)
            .enforceQualityChecks(enforceQualityChecks)
            .enforceInspectionPass(enforceInspectionPass)
            .requireElectronicSig(requireElectronicSig)
            .acceptExternalQuality(acceptExternalQuality)
            .qualityRequired(qualityRequired)
            .build();
    }
}
