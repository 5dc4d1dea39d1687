package com.flagship.partnership_tax.simulation;

import com.flagship.partnership_tax.network.Network;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Final state and score of a sequence run.
 */
@Value
@Builder
public class SimulationResult {
    String simulationId;
    BigDecimal fitness;
    BigDecimal totalCash;
    BigDecimal totalTax;
    Map<String, BigDecimal> taxRecords;
    Map<String, BigDecimal> cashBalances;
    List<TransactionOutcome> outcomes;
    /** Network after the last applied transaction. */
    Network network;

    public long appliedCount() {
        return outcomes.stream().filter(TransactionOutcome::isApplied).count();
    }
}
