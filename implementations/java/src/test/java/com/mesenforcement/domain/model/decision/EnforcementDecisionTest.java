package com.mesenforcement.domain.model.decision;

import com.mesenforcement.domain.model.config.WorkflowMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EnforcementDecision")
class EnforcementDecisionTest {

    private static final CheckResult BYPASSED_GATING = new CheckResult("Status Gating", false, false);

    @Test
    void allowedWithBackedBypass() {
        EnforcementDecision decision = EnforcementDecision.allow(WorkflowMode.FLEXIBLE,
            List.of(BYPASSED_GATING), List.of("status is CREATED"), List.of("status_gating"));

        assertTrue(decision.isAllowed());
        assertTrue(decision.hasBypasses());
        assertTrue(decision.hasWarnings());
        assertNull(decision.getReason());
    }

    @Test
    @DisplayName("a denial requires a reason")
    void denialWithoutReason() {
        assertThrows(IllegalArgumentException.class,
            () -> EnforcementDecision.deny(" ", WorkflowMode.STRICT, List.of()));
    }

    @Test
    @DisplayName("a bypass must be backed by an unenforced failed check")
    void unbackedBypass() {
        assertThrows(IllegalArgumentException.class, () -> EnforcementDecision.allow(WorkflowMode.FLEXIBLE,
            List.of(new CheckResult("Status Gating", true, false)), List.of(), List.of("status_gating")));
        assertThrows(IllegalArgumentException.class, () -> EnforcementDecision.allow(WorkflowMode.FLEXIBLE,
            List.of(BYPASSED_GATING), List.of(), List.of("operation_sequence")));
    }

    @Test
    void unknownBypassId() {
        assertThrows(IllegalArgumentException.class, () -> EnforcementDecision.allow(WorkflowMode.FLEXIBLE,
            List.of(BYPASSED_GATING), List.of(), List.of("everything")));
    }

    @Test
    @DisplayName("collections are copied and read-only")
    void immutableCollections() {
        List<CheckResult> checks = new ArrayList<>(List.of(new CheckResult("Operation Status", true, true)));
        EnforcementDecision decision = EnforcementDecision.allow(WorkflowMode.STRICT, checks, List.of(), List.of());

        checks.clear();

        assertEquals(1, decision.getEnforcementChecks().size());
        assertThrows(UnsupportedOperationException.class, () -> decision.getWarnings().add("late"));
    }
}
