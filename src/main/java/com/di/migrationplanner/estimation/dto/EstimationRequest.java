package com.di.migrationplanner.estimation.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request body for the estimation endpoints.
 *
 * <pre>
 * {
 *   "calculators": ["storage-migration"],
 *   "params": { "total_disk_gb": 1000, "transfer_rate_mbps": 1600 }
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EstimationRequest {

    /** Calculators to run; null or empty means all registered. Ignored by the single-calculator endpoint. */
    private List<String> calculators;

    /** Raw parameter values keyed by parameter name. */
    @NotNull(message = "params must not be null")
    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();
}
