package com.flagship.partnership_tax.transaction;

import lombok.Value;

/**
 * The whole interest the giver holds in {@code downstreamEntity}.
 */
@Value
public class PartnershipInterestGood implements Good {
    String downstreamEntity;

    @Override
    public GoodKind getKind() {
        return GoodKind.PARTNERSHIP_INTEREST;
    }

    @Override
    public String describe() {
        return "interest in " + downstreamEntity;
    }
}
