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
 * Nonconformance report, read for disposition legality checks only.
 */
@Entity
@Immutable
@Table(name = "non_conformance_reports")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NonConformanceReport {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "site_id")
    private String siteId;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false)
    private NcrSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private NcrStatus status;

    public boolean isClosed() {
        return status == NcrStatus.CLOSED;
    }
}
