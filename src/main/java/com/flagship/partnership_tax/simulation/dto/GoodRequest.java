package com.flagship.partnership_tax.simulation.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.partnership_tax.transaction.AssetGood;
import com.flagship.partnership_tax.transaction.CashGood;
import com.flagship.partnership_tax.transaction.Good;
import com.flagship.partnership_tax.transaction.GoodKind;
import com.flagship.partnership_tax.transaction.PartnershipInterestGood;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One leg of a transaction. Which of {@code asset}, {@code entity} and
 * {@code amount} is required depends on {@code kind}.
 */
@Value
public class GoodRequest {

    @NotNull(message = "Good kind is required")
    @JsonProperty("kind")
    GoodKind kind;

    @JsonProperty("asset")
    String asset;

    /** Entity whose partnership interest is handed over. */
    @JsonProperty("entity")
    String entity;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonIgnore
    @AssertTrue(message = "ASSET needs 'asset', PARTNERSHIP_INTEREST needs 'entity', CASH needs a positive 'amount'")
    public boolean isComplete() {
        if (kind == null) {
            return true;
        }
        return switch (kind) {
            case ASSET -> asset != null && !asset.isBlank();
            case PARTNERSHIP_INTEREST -> entity != null && !entity.isBlank();
            case CASH -> amount != null && amount.signum() > 0;
        };
    }

    public Good toGood() {
        return switch (kind) {
            case ASSET -> new AssetGood(asset);
            case PARTNERSHIP_INTEREST -> new PartnershipInterestGood(entity);
            case CASH -> new CashGood(amount);
        };
    }
}
