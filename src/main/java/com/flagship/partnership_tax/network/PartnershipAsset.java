package com.flagship.partnership_tax.network;

import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A partner's fractional view of a holding of the entity it is partnered with.
 *
 * The source is the mirrored holding one tier down: an {@link Asset} for a
 * direct holding, another PartnershipAsset for a deeper tier. FMV is always
 * derived from the source; inside basis is tracked on its own because basis
 * adjustments change it without touching the source.
 *
 * Equality is identity: two mirrors with the same figures are still different
 * positions.
 */
@Getter
public class PartnershipAsset implements Holding {

    private final Holding source;
    private final BigDecimal share;

    @Setter
    private BigDecimal insideBasis;

    public PartnershipAsset(Holding source, BigDecimal share, BigDecimal insideBasis) {
        this.source = Objects.requireNonNull(source);
        this.share = Objects.requireNonNull(share);
        this.insideBasis = Objects.requireNonNull(insideBasis);
    }

    /**
     * Mirrors a holding at the given share, starting from its proportional basis.
     */
    public static PartnershipAsset mirror(Holding source, BigDecimal share) {
        return new PartnershipAsset(source, share, source.getMirroredBasis().multiply(share));
    }

    @Override
    public BigDecimal getFmv() {
        return source.getFmv().multiply(share);
    }

    @Override
    public BigDecimal getMirroredBasis() {
        return insideBasis;
    }

    @Override
    public Asset getUnderlyingAsset() {
        return source.getUnderlyingAsset();
    }

    /**
     * Whether this position mirrors exactly the given holding.
     */
    public boolean mirrors(Holding holding) {
        return source == holding;
    }

    /**
     * Built-in loss carried by this position (positive when inside basis exceeds FMV).
     */
    public BigDecimal builtInLoss() {
        return insideBasis.subtract(getFmv());
    }

    @Override
    public String toString() {
        return String.format("PartnershipAsset(%s, type=%s, share=%s, insideBasis=%s, fmv=%s)",
            getName(), getType(), share, insideBasis, getFmv());
    }
}
