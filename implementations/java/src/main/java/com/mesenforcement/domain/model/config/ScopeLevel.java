package com.mesenforcement.domain.model.config;

/**
 * Levels of the override hierarchy, from least to most specific.
 */
public enum ScopeLevel {
    SYSTEM_DEFAULT,
    SITE,
    ROUTING,
    WORK_ORDER,
    OPERATION
}
