package com.di.migrationplanner.estimation;

import com.di.migrationplanner.config.RequestIdFilter;
import com.di.migrationplanner.estimation.dto.CalculatorInfo;
import com.di.migrationplanner.estimation.dto.EstimationBatchResponse;
import com.di.migrationplanner.estimation.dto.EstimationOutcome;
import com.di.migrationplanner.estimation.dto.EstimationRequest;
import com.di.migrationplanner.estimation.dto.EstimationResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Estimation API.
 * <ul>
 *   <li>GET  /api/estimation/calculators – registered calculators and their required keys</li>
 *   <li>POST /api/estimation/calculators/{name} – run one calculator; bad parameters give 400</li>
 *   <li>POST /api/estimation – run several (default all); failures are reported per calculator</li>
 * </ul>
 */
@RestController
@RequestMapping(value = "/api/estimation", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class EstimationController {

    private final EstimationService estimationService;

    @GetMapping("/calculators")
    public List<CalculatorInfo> listCalculators() {
        return estimationService.listCalculators();
    }

    @PostMapping(value = "/calculators/{name}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public EstimationResponse estimate(@PathVariable("name") String name, @Valid @RequestBody EstimationRequest request) {
        return estimationService.estimate(name, request.getParams());
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EstimationBatchResponse> estimateAll(@Valid @RequestBody EstimationRequest request,
                                                               HttpServletRequest httpRequest) {
        List<EstimationOutcome> outcomes = estimationService.estimateAll(request.getCalculators(), request.getParams());
        int succeeded = (int) outcomes.stream().filter(EstimationOutcome::isSuccess).count();
        return ResponseEntity.ok(EstimationBatchResponse.builder()
                .requestId(RequestIdFilter.getRequestId(httpRequest))
                .outcomes(outcomes)
                .succeeded(succeeded)
                .failed(outcomes.size() - succeeded)
                .build());
    }
}
