package com.mesenforcement.domain.model;

/**
 * Role level that must apply an electronic signature.
 */
public enum SignatureLevel {
    OPERATOR,
    SUPERVISOR,
    QUALITY,
    ENGINEER,
    MANAGER
}
