package com.flagship.partnership_tax.basis;

import com.flagship.partnership_tax.config.SimulationProperties;
import com.flagship.partnership_tax.network.Entity;
import com.flagship.partnership_tax.network.Network;
import com.flagship.partnership_tax.network.PartnershipAsset;
import com.flagship.partnership_tax.ownership.UpstreamPropagator;
import com.flagship.partnership_tax.transaction.AssetGood;
import com.flagship.partnership_tax.transaction.CashGood;
import com.flagship.partnership_tax.transaction.Good;
import com.flagship.partnership_tax.transaction.GoodKind;
import com.flagship.partnership_tax.transaction.PartnershipInterestGood;
import com.flagship.partnership_tax.transaction.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Adjusts the inside basis of partnership assets when an interest changes
 * hands under a Section 754 election or with a substantial built-in loss.
 *
 * Runs before tax is computed, so the tax step sees the adjusted basis.
 * Fair market values are never touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BasisAdjustmentService {

    private final UpstreamPropagator propagator;
    private final SimulationProperties properties;

    /**
     * Applies the basis adjustment if the transaction triggers one.
     *
     * Each side that gives a partnership interest has every position of that
     * interest stepped to the basis of the good it receives in exchange, and
     * the new inside basis is carried up through every partner tier.
     *
     * @return true if an adjustment was triggered
     */
    public boolean maybeAdjustBasis(Network network, Transaction transaction) {
        Entity from = network.requireEntity(transaction.getEntityFrom());
        Entity to = network.requireEntity(transaction.getEntityTo());

        boolean election = transaction.isSection754Election() && transaction.involvesPartnershipInterest();
        boolean substantialLoss = hasSubstantialBuiltInLoss(network, from, transaction.getGoodFrom())
            || hasSubstantialBuiltInLoss(network, to, transaction.getGoodTo());

        if (!election && !substantialLoss) {
            return false;
        }

        // Both exchanged bases are read before either side is adjusted.
        BigDecimal basisForFrom = exchangedBasis(network, to, transaction.getGoodTo());
        BigDecimal basisForTo = exchangedBasis(network, from, transaction.getGoodFrom());

        if (transaction.getGoodFrom().getKind() == GoodKind.PARTNERSHIP_INTEREST) {
            adjustInterest(network, from, downstreamOf(transaction.getGoodFrom()), basisForFrom);
        }
        if (transaction.getGoodTo().getKind() == GoodKind.PARTNERSHIP_INTEREST) {
            adjustInterest(network, to, downstreamOf(transaction.getGoodTo()), basisForTo);
        }

        log.info("Basis adjustment applied: election={}, substantialLoss={}, transaction=[{}]",
            election, substantialLoss, transaction);
        return true;
    }

    /**
     * Loss built into the good the entity gives away: basis minus FMV for an
     * asset, summed inside basis minus FMV over the non-excluded positions of
     * a partnership interest, zero for cash.
     */
    public BigDecimal builtInLoss(Network network, Entity owner, Good good) {
        return switch (good.getKind()) {
            case ASSET -> {
                var asset = network.requireAsset(((AssetGood) good).getAssetName());
                yield asset.getBasis().subtract(asset.getFmv());
            }
            case PARTNERSHIP_INTEREST -> owner.getLedger(downstreamOf(good))
                .stream()
                .filter(position -> !properties.isExcluded(position.getType()))
                .map(PartnershipAsset::builtInLoss)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            case CASH -> BigDecimal.ZERO;
        };
    }

    /**
     * Loss strictly above the configured threshold.
     */
    public boolean hasSubstantialBuiltInLoss(Network network, Entity owner, Good good) {
        return builtInLoss(network, owner, good).compareTo(properties.getSubstantialLossThreshold()) > 0;
    }

    /**
     * Basis of what the counterparty hands over: asset basis, cash amount, or
     * the summed inside basis of a partnership interest.
     */
    BigDecimal exchangedBasis(Network network, Entity giver, Good good) {
        return switch (good.getKind()) {
            case ASSET -> network.requireAsset(((AssetGood) good).getAssetName()).getBasis();
            case PARTNERSHIP_INTEREST -> giver.getLedger(downstreamOf(good))
                .stream()
                .map(PartnershipAsset::getInsideBasis)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            case CASH -> ((CashGood) good).getAmount();
        };
    }

    private static String downstreamOf(Good good) {
        return ((PartnershipInterestGood) good).getDownstreamEntity();
    }

    private void adjustInterest(Network network, Entity holder, String downstream, BigDecimal exchangedBasis) {
        List<PartnershipAsset> positions = holder.getLedger(downstream);
        for (PartnershipAsset position : positions) {
            BigDecimal adjustment = exchangedBasis.subtract(position.getInsideBasis());
            position.setInsideBasis(position.getInsideBasis().add(adjustment));
        }
        int mirrors = propagator.propagateInsideBasis(network, holder.getName(), positions);
        log.debug("Adjusted inside basis of {} position(s) in {} held by {}, {} upstream mirror(s) updated",
            positions.size(), downstream, holder.getName(), mirrors);
    }
}
