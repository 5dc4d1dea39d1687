package com.flagship.partnership_tax.transaction;

/**
 * One leg of a transaction. Goods refer to assets and entities by name and
 * are resolved against the network the transaction is applied to.
 */
public interface Good {

    GoodKind getKind();

    /**
     * Short label for logs and error details.
     */
    String describe();
}
