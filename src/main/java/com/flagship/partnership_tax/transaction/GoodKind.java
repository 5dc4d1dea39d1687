package com.flagship.partnership_tax.transaction;

/**
 * What is being handed over in one leg of a transaction.
 */
public enum GoodKind {
    ASSET,
    PARTNERSHIP_INTEREST,
    CASH
}
