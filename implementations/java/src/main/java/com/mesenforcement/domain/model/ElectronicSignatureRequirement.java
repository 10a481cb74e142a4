package com.mesenforcement.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Signature requirement row keyed by {@code (actionType, siteId)}; a null site marks
 * the global fallback row for that action type.
 */
@Entity
@Immutable
@Table(name = "electronic_signature_requirements")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ElectronicSignatureRequirement {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "action_type", nullable = false)
    private String actionType;

    @Column(name = "site_id")
    private String siteId;

    @Column(name = "requires_signature", nullable = false)
    private boolean requiresSignature;

    @Enumerated(EnumType.STRING)
    @Column(name = "signature_level")
    private SignatureLevel signatureLevel;
}
