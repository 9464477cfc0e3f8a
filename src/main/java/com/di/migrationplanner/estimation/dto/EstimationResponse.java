package com.di.migrationplanner.estimation.dto;

import com.di.migrationplanner.estimation.Estimation;
import lombok.Builder;
import lombok.Value;

/**
 * A successful estimate for one calculator.
 */
@Value
@Builder
public class EstimationResponse {
    String calculator;
    /** Duration in (fractional) minutes. */
    double durationMinutes;
    /** ISO-8601 duration, e.g. "PT1H". */
    String duration;
    String reason;

    public static EstimationResponse from(String calculator, Estimation estimation) {
        return EstimationResponse.builder()
                .calculator(calculator)
                .durationMinutes(estimation.getDurationMinutes())
                .duration(estimation.getDuration().toString())
                .reason(estimation.getReason())
                .build();
    }
}
