package com.flagship.partnership_tax.network;

/**
 * Category of a directly owned asset.
 *
 * The type decides whether a sale is taxable: annuity-type assets are
 * excluded from tax computation by default (see simulation.excluded-asset-types).
 */
public enum AssetType {
    MATERIAL,
    ANNUITY,
    SECURITY,
    REAL_ESTATE
}
