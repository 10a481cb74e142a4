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
 * Work order as seen by the enforcement engine.
 *
 * <p>Owned by the work-order store. The engine reads status and scope identifiers
 * (site, routing) and never writes this table.
 *
 * @since 1.0.0
 */
@Entity
@Immutable
@Table(name = "work_orders")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WorkOrder {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "site_id", nullable = false)
    private String siteId;

    /**
     * Routing the work order was released against, null for ad hoc work orders.
     */
    @Column(name = "routing_id")
    private String routingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private WorkOrderStatus status;
}
