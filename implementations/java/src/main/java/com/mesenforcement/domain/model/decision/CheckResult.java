package com.mesenforcement.domain.model.decision;

import lombok.Value;

/**
 * Outcome of one named check inside a decision.
 *
 * <p>{@code enforced=false, passed=false} is the signature of a bypassed soft check.
 */
@Value
public class CheckResult {
    String name;
    boolean enforced;
    boolean passed;

    public boolean isBypassed() {
        return !enforced && !passed;
    }
}
