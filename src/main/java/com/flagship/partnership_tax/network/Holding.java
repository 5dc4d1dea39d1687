package com.flagship.partnership_tax.network;

import java.math.BigDecimal;

/**
 * Something an entity can hold and an upstream partner can mirror:
 * either a directly owned {@link Asset} or a {@link PartnershipAsset}.
 */
public interface Holding {

    BigDecimal getFmv();

    /**
     * Basis an upstream mirror starts from: the asset basis for a direct asset,
     * the inside basis for a partnership asset.
     */
    BigDecimal getMirroredBasis();

    Asset getUnderlyingAsset();

    default AssetType getType() {
        return getUnderlyingAsset().getType();
    }

    default String getName() {
        return getUnderlyingAsset().getName();
    }
}
