package com.di.migrationplanner.estimation.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EstimationBatchResponse {
    String requestId;
    List<EstimationOutcome> outcomes;
    int succeeded;
    int failed;
}
