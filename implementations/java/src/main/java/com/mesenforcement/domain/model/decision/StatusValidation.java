package com.mesenforcement.domain.model.decision;

import com.mesenforcement.domain.model.WorkOrderStatus;
import lombok.Value;

@Value
public class StatusValidation {
    boolean valid;
    WorkOrderStatus currentStatus;
    String reason;
}
