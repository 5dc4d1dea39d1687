package com.flagship.partnership_tax.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.partnership_tax.transaction.Transaction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request DTO for one proposed transaction.
 */
@Value
public class TransactionRequest {

    @NotBlank(message = "Giving entity is required")
    @JsonProperty("entity_from")
    String entityFrom;

    @NotBlank(message = "Receiving entity is required")
    @JsonProperty("entity_to")
    String entityTo;

    @NotNull(message = "Good given is required")
    @Valid
    @JsonProperty("good_from")
    GoodRequest goodFrom;

    @NotNull(message = "Good received is required")
    @Valid
    @JsonProperty("good_to")
    GoodRequest goodTo;

    @JsonProperty("section_754_election")
    boolean section754Election;

    public Transaction toTransaction() {
        return Transaction.builder()
            .entityFrom(entityFrom)
            .entityTo(entityTo)
            .goodFrom(goodFrom.toGood())
            .goodTo(goodTo.toGood())
            .section754Election(section754Election)
            .build();
    }
}
