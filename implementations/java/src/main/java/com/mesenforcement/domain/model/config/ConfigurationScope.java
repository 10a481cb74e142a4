package com.mesenforcement.domain.model.config;

import com.mesenforcement.domain.model.WorkOrder;
import com.mesenforcement.domain.model.WorkOrderOperation;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Identifiers of the scopes a decision request touches. Site is always present.
 */
@Value
@Builder
public class ConfigurationScope {

    @NonNull
    String siteId;
    String routingId;
    String workOrderId;
    String operationId;

    public static ConfigurationScope of(WorkOrder workOrder) {
        return ConfigurationScope.builder()
            .siteId(workOrder.getSiteId())
            .routingId(workOrder.getRoutingId())
            .workOrderId(workOrder.getId())
            .build();
    }

    public static ConfigurationScope of(WorkOrder workOrder, WorkOrderOperation operation) {
        return ConfigurationScope.builder()
            .siteId(workOrder.getSiteId())
            .routingId(workOrder.getRoutingId())
            .workOrderId(workOrder.getId())
            .operationId(operation.getId())
            .build();
    }

    /**
     * Present scopes ordered most-specific first.
     */
    public List<Map.Entry<ScopeLevel, String>> mostSpecificFirst() {
        List<Map.Entry<ScopeLevel, String>> levels = new ArrayList<>(4);
        if (operationId != null) {
            levels.add(Map.entry(ScopeLevel.OPERATION, operationId));
        }
        if (workOrderId != null) {
            levels.add(Map.entry(ScopeLevel.WORK_ORDER, workOrderId));
        }
        if (routingId != null) {
            levels.add(Map.entry(ScopeLevel.ROUTING, routingId));
        }
        levels.add(Map.entry(ScopeLevel.SITE, siteId));
        return Collections.unmodifiableList(levels);
    }
}
