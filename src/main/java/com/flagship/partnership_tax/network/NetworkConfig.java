package com.flagship.partnership_tax.network;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything needed to build a network: entities with their starting cash,
 * directly owned assets and partnership edges.
 */
@Value
@Builder
public class NetworkConfig {
    @Singular
    List<EntitySpec> entities;
    @Singular
    List<AssetSpec> assets;
    @Singular
    List<PartnershipSpec> partnerships;

    @Value
    public static class EntitySpec {
        String name;
        BigDecimal cash;
    }

    /**
     * A directly owned asset. A null FMV defaults to the basis.
     */
    @Value
    public static class AssetSpec {
        String owner;
        String name;
        AssetType type;
        BigDecimal basis;
        BigDecimal fmv;
    }

    /**
     * {@code upstream} owns {@code share} of {@code downstream}.
     */
    @Value
    public static class PartnershipSpec {
        String upstream;
        String downstream;
        BigDecimal share;
    }
}
