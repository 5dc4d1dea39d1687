package com.flagship.partnership_tax.exception;

/**
 * Reasons a network cannot be built or a transaction cannot be applied.
 */
public enum ErrorCode {
    /** Entity does not hold the asset, interest or cash it is giving. */
    INSUFFICIENT_GOOD,
    DUPLICATE_ASSET_NAME,
    DUPLICATE_ENTITY,
    DUPLICATE_PARTNERSHIP,
    /** Share outside (0, 1], or more than 100% of an entity allocated to partners. */
    INVALID_SHARE,
    /** Structurally invalid transaction, e.g. an entity trading with itself. */
    INVALID_TRANSACTION,
    CYCLIC_OWNERSHIP,
    UNKNOWN_ENTITY,
    UNKNOWN_ASSET
}
