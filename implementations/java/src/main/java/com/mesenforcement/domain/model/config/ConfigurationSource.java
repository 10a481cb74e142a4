package com.mesenforcement.domain.model.config;

import lombok.Builder;
import lombok.Value;

/**
 * Provenance of an effective configuration: which scopes contributed at least one
 * winning value, and the winning scope of the two fields callers report on.
 */
@Value
@Builder
public class ConfigurationSource {
    boolean site;
    boolean routing;
    boolean workOrder;
    boolean operation;
    ScopeLevel modeSource;
    ScopeLevel qualityRequiredSource;
}
