package com.flagship.partnership_tax.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.partnership_tax.exception.ErrorCode;
import com.flagship.partnership_tax.simulation.SimulationResult;
import com.flagship.partnership_tax.simulation.TransactionOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a sequence run.
 */
@Value
@Builder
public class SimulationResponse {

    @JsonProperty("simulation_id")
    String simulationId;

    @JsonProperty("fitness")
    BigDecimal fitness;

    @JsonProperty("total_cash")
    BigDecimal totalCash;

    @JsonProperty("total_tax")
    BigDecimal totalTax;

    @JsonProperty("tax_records")
    Map<String, BigDecimal> taxRecords;

    @JsonProperty("cash_balances")
    Map<String, BigDecimal> cashBalances;

    @JsonProperty("outcomes")
    List<Outcome> outcomes;

    public static SimulationResponse from(SimulationResult result) {
        return SimulationResponse.builder()
            .simulationId(result.getSimulationId())
            .fitness(result.getFitness())
            .totalCash(result.getTotalCash())
            .totalTax(result.getTotalTax())
            .taxRecords(result.getTaxRecords())
            .cashBalances(result.getCashBalances())
            .outcomes(result.getOutcomes().stream().map(Outcome::from).toList())
            .build();
    }

    @Value
    @Builder
    public static class Outcome {
        @JsonProperty("index")
        int index;

        @JsonProperty("transaction")
        String transaction;

        @JsonProperty("applied")
        boolean applied;

        @JsonProperty("fitness_after")
        BigDecimal fitnessAfter;

        @JsonProperty("error_code")
        ErrorCode errorCode;

        @JsonProperty("message")
        String message;

        @JsonProperty("details")
        Map<String, String> details;

        static Outcome from(TransactionOutcome outcome) {
            return Outcome.builder()
                .index(outcome.getIndex())
                .transaction(outcome.getDescription())
                .applied(outcome.isApplied())
                .fitnessAfter(outcome.getFitnessAfter())
                .errorCode(outcome.getErrorCode())
                .message(outcome.getMessage())
                .details(outcome.getDetails())
                .build();
        }
    }
}
