package com.flagship.partnership_tax.transaction;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Proposed exchange: {@code entityFrom} gives {@code goodFrom} to
 * {@code entityTo} and receives {@code goodTo} in return.
 *
 * Consumed by the transaction engine and not retained.
 */
@Value
public class Transaction {
    String entityFrom;
    String entityTo;
    Good goodFrom;
    Good goodTo;
    boolean section754Election;

    @Builder
    public Transaction(String entityFrom, String entityTo, Good goodFrom, Good goodTo,
                       boolean section754Election) {
        this.entityFrom = Objects.requireNonNull(entityFrom, "entityFrom");
        this.entityTo = Objects.requireNonNull(entityTo, "entityTo");
        this.goodFrom = Objects.requireNonNull(goodFrom, "goodFrom");
        this.goodTo = Objects.requireNonNull(goodTo, "goodTo");
        this.section754Election = section754Election;
    }

    public boolean involvesPartnershipInterest() {
        return goodFrom.getKind() == GoodKind.PARTNERSHIP_INTEREST
            || goodTo.getKind() == GoodKind.PARTNERSHIP_INTEREST;
    }

    @Override
    public String toString() {
        return String.format("%s gives %s to %s for %s%s", entityFrom, goodFrom.describe(),
            entityTo, goodTo.describe(), section754Election ? " (754 election)" : "");
    }
}
