package com.flagship.partnership_tax.network;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * A directly owned asset.
 *
 * Identity is the generated {@link #id}; the name is a unique display key
 * within a network. Type and fair market value never change. The basis only
 * changes through {@link #realizeGain()}, when the asset changes hands.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Asset implements Holding {

    @EqualsAndHashCode.Include
    private final UUID id;
    private final String name;
    private final AssetType type;
    private final BigDecimal fmv;
    private BigDecimal basis;

    private Asset(UUID id, String name, AssetType type, BigDecimal basis, BigDecimal fmv) {
        this.id = Objects.requireNonNull(id);
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        this.basis = Objects.requireNonNull(basis);
        this.fmv = fmv != null ? fmv : basis;
    }

    /**
     * Creates an asset with a fresh id. FMV defaults to the basis when null.
     */
    public static Asset create(String name, AssetType type, BigDecimal basis, BigDecimal fmv) {
        return new Asset(UUID.randomUUID(), name, type, basis, fmv);
    }

    /**
     * Steps the basis up (or down) to fair market value.
     * Called once per transfer, after the gain has been taxed.
     */
    public void realizeGain() {
        this.basis = this.fmv;
    }

    /**
     * Copy with the same id, used when a network is cloned.
     */
    Asset copy() {
        return new Asset(id, name, type, basis, fmv);
    }

    @Override
    public BigDecimal getMirroredBasis() {
        return basis;
    }

    @Override
    public Asset getUnderlyingAsset() {
        return this;
    }

    @Override
    public String toString() {
        return String.format("Asset(%s, type=%s, basis=%s, fmv=%s)", name, type, basis, fmv);
    }
}
