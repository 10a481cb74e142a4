package com.mesenforcement.application;

import com.mesenforcement.domain.model.config.EnforcementMode;
import com.mesenforcement.domain.model.decision.BypassType;
import com.mesenforcement.domain.model.decision.CheckResult;
import com.mesenforcement.domain.model.decision.EnforcementDecision;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Accumulates the checks of one decision in evaluation order.
 *
 * <p>Hard checks are always enforced. Soft checks either pass, block (when their flag
 * is on) or are bypassed with warnings. Not thread-safe; one instance per call.
 */
final class EnforcementChecklist {

    private final List<CheckResult> checks = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final Set<String> bypasses = new LinkedHashSet<>();

    /**
     * Record an always-enforced check.
     *
     * @return whether it passed
     */
    boolean hard(String name, boolean passed) {
        checks.add(new CheckResult(name, true, passed));
        return passed;
    }

    /**
     * Record a soft check that passed, or that failed while its flag enforced it.
     */
    void soft(String name, boolean enforced, boolean passed) {
        checks.add(new CheckResult(name, enforced, passed));
    }

    /**
     * Record a soft check that failed while its flag was off.
     */
    void bypass(BypassType type, Collection<String> bypassWarnings) {
        checks.add(new CheckResult(type.checkName(), false, false));
        warnings.addAll(bypassWarnings);
        bypasses.add(type.id());
    }

    /**
     * Fold in the checks, warnings and bypasses of a sub-decision.
     */
    void include(EnforcementDecision decision) {
        checks.addAll(decision.getEnforcementChecks());
        warnings.addAll(decision.getWarnings());
        bypasses.addAll(decision.getBypassesApplied());
    }

    EnforcementDecision allow(EnforcementMode mode) {
        return EnforcementDecision.allow(mode, checks, warnings, List.copyOf(bypasses));
    }

    EnforcementDecision deny(String reason, EnforcementMode mode) {
        return EnforcementDecision.deny(reason, mode, checks);
    }
}
