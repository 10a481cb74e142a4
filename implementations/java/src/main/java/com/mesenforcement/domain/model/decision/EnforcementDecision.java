package com.mesenforcement.domain.model.decision;

import com.mesenforcement.domain.model.config.EnforcementMode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Objects;

/**
 * Answer to one "may this action proceed?" question.
 *
 * <p><strong>Invariants</strong> (checked on construction):
 * <ul>
 *   <li>a denied decision carries a reason, no bypasses and no warnings</li>
 *   <li>every bypass id names a check in {@link #enforcementChecks} that was neither
 *       enforced nor passed</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
@ToString
public final class EnforcementDecision {

    private final boolean allowed;
    private final String reason;
    private final List<String> warnings;
    private final List<String> bypassesApplied;
    private final EnforcementMode configMode;
    private final List<CheckResult> enforcementChecks;

    private EnforcementDecision(
            boolean allowed,
            String reason,
            List<String> warnings,
            List<String> bypassesApplied,
            EnforcementMode configMode,
            List<CheckResult> enforcementChecks) {

        this.allowed = allowed;
        this.reason = reason;
        this.warnings = List.copyOf(warnings);
        this.bypassesApplied = List.copyOf(bypassesApplied);
        this.configMode = configMode;
        this.enforcementChecks = List.copyOf(enforcementChecks);

        if (!allowed) {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("A denied decision requires a reason");
            }
            if (!this.bypassesApplied.isEmpty() || !this.warnings.isEmpty()) {
                throw new IllegalArgumentException("A denied decision cannot carry bypasses or warnings");
            }
        }
        this.bypassesApplied.forEach(this::requireBypassedCheck);
    }

    /**
     * Allowed decision; warnings and bypasses may be empty.
     */
    public static EnforcementDecision allow(
            EnforcementMode configMode,
            List<CheckResult> checks,
            List<String> warnings,
            List<String> bypassesApplied) {
        return new EnforcementDecision(true, null, warnings, bypassesApplied, configMode, checks);
    }

    public static EnforcementDecision deny(String reason, EnforcementMode configMode, List<CheckResult> checks) {
        return new EnforcementDecision(false, reason, List.of(), List.of(), configMode, checks);
    }

    public boolean hasBypasses() {
        return !bypassesApplied.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean isDenied() {
        return !allowed;
    }

    private void requireBypassedCheck(String bypassId) {
        String checkName = BypassType.fromId(bypassId)
            .map(BypassType::checkName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown bypass id: " + bypassId));

        boolean backed = enforcementChecks.stream()
            .filter(check -> Objects.equals(check.getName(), checkName))
            .anyMatch(CheckResult::isBypassed);

        if (!backed) {
            throw new IllegalArgumentException(
                "Bypass " + bypassId + " has no matching unenforced, failed check '" + checkName + "'");
        }
    }
}
