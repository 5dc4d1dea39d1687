package com.flagship.partnership_tax.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.partnership_tax.transaction.Transaction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

/**
 * Request DTO for evaluating a transaction sequence.
 */
@Value
public class SimulationRequest {

    @NotNull(message = "Network is required")
    @Valid
    @JsonProperty("network")
    NetworkRequest network;

    @NotNull(message = "Transactions are required")
    @JsonProperty("transactions")
    List<@Valid TransactionRequest> transactions;

    public List<Transaction> toTransactions() {
        return transactions.stream()
            .map(TransactionRequest::toTransaction)
            .toList();
    }
}
