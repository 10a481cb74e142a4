package com.mesenforcement.domain.model.decision;

import com.mesenforcement.domain.model.config.QualityMode;
import com.mesenforcement.domain.model.config.ScopeLevel;
import lombok.Builder;
import lombok.Value;

/**
 * Whether an operation needs a quality inspection, and which scope decided it.
 */
@Value
@Builder
public class QualityRequirement {
    boolean required;
    /** {@code qualityRequired=false} at the resolved scope; no inspection outcome applies. */
    boolean exempt;
    QualityMode mode;
    String reason;
    ScopeLevel source;
}
