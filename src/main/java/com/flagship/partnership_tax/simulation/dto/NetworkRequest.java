package com.flagship.partnership_tax.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.partnership_tax.network.AssetType;
import com.flagship.partnership_tax.network.NetworkConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO describing the starting network of a simulation.
 */
@Value
public class NetworkRequest {

    @NotEmpty(message = "At least one entity is required")
    @JsonProperty("entities")
    List<@Valid EntityRequest> entities;

    @JsonProperty("assets")
    List<@Valid AssetRequest> assets;

    @JsonProperty("partnerships")
    List<@Valid PartnershipRequest> partnerships;

    public NetworkConfig toConfig() {
        NetworkConfig.NetworkConfigBuilder builder = NetworkConfig.builder();
        entities.forEach(entity -> builder.entity(
            new NetworkConfig.EntitySpec(entity.getName(), entity.getCash())));
        if (assets != null) {
            assets.forEach(asset -> builder.asset(new NetworkConfig.AssetSpec(
                asset.getOwner(), asset.getName(), asset.getType(), asset.getBasis(), asset.getFmv())));
        }
        if (partnerships != null) {
            partnerships.forEach(partnership -> builder.partnership(new NetworkConfig.PartnershipSpec(
                partnership.getUpstream(), partnership.getDownstream(), partnership.getShare())));
        }
        return builder.build();
    }

    @Value
    public static class EntityRequest {
        @NotBlank(message = "Entity name is required")
        @JsonProperty("name")
        String name;

        @NotNull(message = "Starting cash is required")
        @PositiveOrZero(message = "Starting cash cannot be negative")
        @JsonProperty("cash")
        BigDecimal cash;
    }

    @Value
    public static class AssetRequest {
        @NotBlank(message = "Asset owner is required")
        @JsonProperty("owner")
        String owner;

        @NotBlank(message = "Asset name is required")
        @JsonProperty("name")
        String name;

        @NotNull(message = "Asset type is required")
        @JsonProperty("type")
        AssetType type;

        @NotNull(message = "Asset basis is required")
        @JsonProperty("basis")
        BigDecimal basis;

        @JsonProperty("fmv")
        BigDecimal fmv;
    }

    @Value
    public static class PartnershipRequest {
        @NotBlank(message = "Upstream entity is required")
        @JsonProperty("upstream")
        String upstream;

        @NotBlank(message = "Downstream entity is required")
        @JsonProperty("downstream")
        String downstream;

        @NotNull(message = "Share is required")
        @DecimalMin(value = "0", inclusive = false, message = "Share must be greater than 0")
        @DecimalMax(value = "1", message = "Share cannot exceed 1")
        @JsonProperty("share")
        BigDecimal share;
    }
}
