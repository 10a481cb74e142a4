package com.mesenforcement.domain.model;

public enum NcrStatus {
    OPEN,
    UNDER_REVIEW,
    DISPOSITION_SET,
    CLOSED
}
