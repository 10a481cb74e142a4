package com.mesenforcement.domain.model;

/**
 * Resolution chosen for a nonconformance.
 */
public enum NcrDisposition {
    REWORK,
    REPAIR,
    SCRAP,
    USE_AS_IS,
    RETURN_TO_VENDOR
}
