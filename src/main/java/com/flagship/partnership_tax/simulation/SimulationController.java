package com.flagship.partnership_tax.simulation;

import com.flagship.partnership_tax.simulation.dto.SimulationRequest;
import com.flagship.partnership_tax.simulation.dto.SimulationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for evaluating transaction sequences.
 *
 * Stateless: each request brings its own network configuration, and the
 * network built from it lives only for the duration of the request.
 */
@RestController
@RequestMapping("/api/simulations")
@RequiredArgsConstructor
@Slf4j
public class SimulationController {

    private final SimulationService simulationService;

    /**
     * Builds the network, applies the transactions and returns the score.
     *
     * Rejected transactions are reported in the outcomes with a 200 status;
     * an invalid network configuration is answered with 422.
     */
    @PostMapping
    public ResponseEntity<SimulationResponse> simulate(@Valid @RequestBody SimulationRequest request) {
        log.info("Received simulation request: entities={}, transactions={}",
            request.getNetwork().getEntities().size(), request.getTransactions().size());

        SimulationResult result = simulationService.run(request.getNetwork().toConfig(), request.toTransactions());
        return ResponseEntity.ok(SimulationResponse.from(result));
    }
}
