package com.flagship.partnership_tax.simulation;

import com.flagship.partnership_tax.config.SimulationProperties;
import com.flagship.partnership_tax.exception.SimulationException;
import com.flagship.partnership_tax.network.Entity;
import com.flagship.partnership_tax.network.Network;
import com.flagship.partnership_tax.network.NetworkConfig;
import com.flagship.partnership_tax.network.NetworkInitializer;
import com.flagship.partnership_tax.observability.CorrelationContext;
import com.flagship.partnership_tax.observability.SimulationMetrics;
import com.flagship.partnership_tax.transaction.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a whole transaction sequence against a freshly built network.
 *
 * Every run builds its own network, so runs can be evaluated in parallel.
 * A rejected transaction is recorded and skipped, leaving the network as it
 * was; with {@code simulation.stop-on-rejection} the run ends there instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimulationService {

    private final NetworkInitializer networkInitializer;
    private final TransactionEngine transactionEngine;
    private final SimulationProperties properties;
    private final SimulationMetrics metrics;

    /**
     * Builds the network and applies the transactions in order.
     *
     * @throws SimulationException if the configuration itself is invalid
     */
    public SimulationResult run(NetworkConfig config, List<Transaction> transactions) {
        String simulationId = CorrelationContext.generateId();
        MDC.put(CorrelationContext.SIMULATION_ID_MDC_KEY, simulationId);
        metrics.incrementRuns();

        try {
            Network network = networkInitializer.initializeNetwork(config);
            log.info("Simulation started: transactions={}, initialFitness={}",
                transactions.size(), transactionEngine.fitness(network));

            List<TransactionOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < transactions.size(); i++) {
                Transaction transaction = transactions.get(i);
                try {
                    network = transactionEngine.applyTransaction(network, transaction);
                    outcomes.add(TransactionOutcome.applied(i, transaction.toString(),
                        transactionEngine.fitness(network)));
                } catch (SimulationException e) {
                    outcomes.add(TransactionOutcome.rejected(i, transaction.toString(),
                        transactionEngine.fitness(network), e.getErrorCode(), e.getMessage(), e.getDetails()));
                    if (properties.isStopOnRejection()) {
                        log.info("Stopping at rejected transaction {}", i);
                        break;
                    }
                }
            }

            SimulationResult result = summarize(simulationId, network, outcomes);
            log.info("Simulation finished: applied={}/{}, fitness={}",
                result.appliedCount(), transactions.size(), result.getFitness());
            return result;

        } finally {
            MDC.remove(CorrelationContext.SIMULATION_ID_MDC_KEY);
        }
    }

    private SimulationResult summarize(String simulationId, Network network, List<TransactionOutcome> outcomes) {
        Map<String, BigDecimal> cashBalances = new LinkedHashMap<>();
        for (Entity entity : network.getEntities()) {
            cashBalances.put(entity.getName(), entity.getCashBalance());
        }
        return SimulationResult.builder()
            .simulationId(simulationId)
            .fitness(transactionEngine.fitness(network))
            .totalCash(network.totalCashBalance())
            .totalTax(network.totalTaxLiability())
            .taxRecords(new LinkedHashMap<>(network.getTaxRecords()))
            .cashBalances(cashBalances)
            .outcomes(List.copyOf(outcomes))
            .network(network)
            .build();
    }
}
