package com.flagship.partnership_tax.transaction;

import lombok.Value;

/**
 * A directly owned asset, by name.
 */
@Value
public class AssetGood implements Good {
    String assetName;

    @Override
    public GoodKind getKind() {
        return GoodKind.ASSET;
    }

    @Override
    public String describe() {
        return "asset " + assetName;
    }
}
