package com.di.migrationplanner.estimation.dto;

import com.di.migrationplanner.estimation.EstimationError;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Result of one calculator in a multi-calculator request: either an estimate or the reason it is
 * unavailable. Callers decide whether a missing stage aborts their overall plan.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EstimationOutcome {
    String calculator;
    /** Present only on success. */
    EstimationResponse estimation;
    /** Present only on failure. */
    String error;
    EstimationError errorKind;
    /** Parameter that caused the failure. */
    String parameter;

    public boolean isSuccess() {
        return estimation != null;
    }
}
