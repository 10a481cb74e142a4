package com.mesenforcement.domain.model.config;

import java.util.Locale;

/**
 * Independent configuration families. Each has its own override rows and its own mode set.
 */
public enum ConfigurationDomain {
    WORKFLOW,
    QUALITY;

    /**
     * Parse a persisted mode name for this domain.
     *
     * @param value stored mode name, case-insensitive
     * @return the mode, or null when {@code value} is null or blank
     * @throws IllegalArgumentException if the name is not a mode of this domain
     */
    public EnforcementMode parseMode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (this) {
            case WORKFLOW -> WorkflowMode.valueOf(normalized);
            case QUALITY -> QualityMode.valueOf(normalized);
        };
    }

    public EnforcementMode strictMode() {
        return switch (this) {
            case WORKFLOW -> WorkflowMode.STRICT;
            case QUALITY -> QualityMode.STRICT;
        };
    }
}
