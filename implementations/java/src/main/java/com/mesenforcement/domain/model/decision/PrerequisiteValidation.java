package com.mesenforcement.domain.model.decision;

import com.mesenforcement.domain.model.config.WorkflowMode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of walking an operation's prerequisite edges.
 *
 * <p>{@code valid} is true when nothing is unmet, or when the mode tolerates unmet
 * prerequisites (then {@code warnings} is non-empty). Unmet edges are always listed.
 */
@Value
@Builder
public class PrerequisiteValidation {
    boolean valid;
    @Singular
    List<PrerequisiteEdge> unmetPrerequisites;
    @Singular
    List<String> warnings;
    WorkflowMode enforcementMode;

    /** Set only when the operation itself could not be loaded. */
    String reason;

    public boolean hasUnmetPrerequisites() {
        return !unmetPrerequisites.isEmpty();
    }
}
