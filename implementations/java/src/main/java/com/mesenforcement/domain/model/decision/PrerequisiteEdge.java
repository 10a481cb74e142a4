package com.mesenforcement.domain.model.decision;

import com.mesenforcement.domain.model.DependencyType;
import lombok.Builder;
import lombok.Value;

/**
 * One dependency relation between the operation being started and a prerequisite.
 *
 * <p>{@code prerequisiteOperationId} is null when the work order has no operation
 * instance for the prerequisite routing step. {@code reason} is set only for unmet edges.
 */
@Value
@Builder
public class PrerequisiteEdge {
    String prerequisiteOperationId;
    String prerequisiteOperationName;
    int prerequisiteOperationSeq;
    int currentOperationSeq;
    DependencyType dependencyType;
    String reason;
}
