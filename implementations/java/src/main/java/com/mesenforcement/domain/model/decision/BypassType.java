package com.mesenforcement.domain.model.decision;

import java.util.Arrays;
import java.util.Optional;

/**
 * Machine-readable identifiers of soft checks that may be bypassed, each tied to the
 * name of the check that produces it.
 */
public enum BypassType {

    STATUS_GATING("status_gating", "Status Gating"),
    OPERATION_SEQUENCE("operation_sequence", "Operation Sequence"),
    QUALITY_PASS_REQUIREMENT("quality_pass_requirement", "Inspection Pass");

    private final String id;
    private final String checkName;

    BypassType(String id, String checkName) {
        this.id = id;
        this.checkName = checkName;
    }

    public String id() {
        return id;
    }

    public String checkName() {
        return checkName;
    }

    public static Optional<BypassType> fromId(String id) {
        return Arrays.stream(values())
            .filter(type -> type.id.equals(id))
            .findFirst();
    }
}
