package com.flagship.partnership_tax.transaction;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A positive cash amount.
 */
@Value
public class CashGood implements Good {
    BigDecimal amount;

    public CashGood(BigDecimal amount) {
        this.amount = Objects.requireNonNull(amount);
        if (amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Cash amount must be positive");
        }
    }

    public static CashGood of(String amount) {
        return new CashGood(new BigDecimal(amount));
    }

    @Override
    public GoodKind getKind() {
        return GoodKind.CASH;
    }

    @Override
    public String describe() {
        return "cash " + amount.toPlainString();
    }
}
