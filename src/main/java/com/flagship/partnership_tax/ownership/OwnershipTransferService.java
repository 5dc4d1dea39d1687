package com.flagship.partnership_tax.ownership;

import com.flagship.partnership_tax.network.Asset;
import com.flagship.partnership_tax.network.Entity;
import com.flagship.partnership_tax.network.Holding;
import com.flagship.partnership_tax.network.Network;
import com.flagship.partnership_tax.network.PartnershipAsset;
import com.flagship.partnership_tax.network.PartnershipEdge;
import com.flagship.partnership_tax.exception.SimulationException;
import com.flagship.partnership_tax.transaction.AssetGood;
import com.flagship.partnership_tax.transaction.CashGood;
import com.flagship.partnership_tax.transaction.Good;
import com.flagship.partnership_tax.transaction.GoodKind;
import com.flagship.partnership_tax.transaction.PartnershipInterestGood;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Moves a good from one entity to another and reflects the move in every
 * affected partnership tier.
 *
 * Runs after the basis and tax steps, which must see the network as it was
 * before the transfer. Viability has already been checked by the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OwnershipTransferService {

    private final UpstreamPropagator propagator;

    /**
     * Carries out both legs of an exchange: {@code goodFrom} moves from
     * {@code from} to {@code to} and {@code goodTo} moves back.
     *
     * When both legs are partnership interests, both are detached before
     * either is attached, so two interests in the same entity trade places
     * instead of the second leg picking up the first.
     */
    public void exchange(Network network, Entity from, Entity to, Good goodFrom, Good goodTo) {
        if (goodFrom.getKind() == GoodKind.PARTNERSHIP_INTEREST && goodTo.getKind() == GoodKind.PARTNERSHIP_INTEREST) {
            DetachedInterest given = detachInterest(network, from, ((PartnershipInterestGood) goodFrom).getDownstreamEntity());
            DetachedInterest received = detachInterest(network, to, ((PartnershipInterestGood) goodTo).getDownstreamEntity());
            attachInterest(network, to, given);
            attachInterest(network, from, received);
            log.debug("Swapped interests: {} in {} for {} in {}",
                from.getName(), given.getDownstream(), to.getName(), received.getDownstream());
            return;
        }
        adjustOwnership(network, from, to, goodFrom);
        adjustOwnership(network, to, from, goodTo);
    }

    /**
     * Transfers {@code good} from {@code from} to {@code to}.
     */
    public void adjustOwnership(Network network, Entity from, Entity to, Good good) {
        switch (good.getKind()) {
            case ASSET -> transferAsset(network, from, to, network.requireAsset(((AssetGood) good).getAssetName()));
            case PARTNERSHIP_INTEREST ->
                transferInterest(network, from, to, ((PartnershipInterestGood) good).getDownstreamEntity());
            case CASH -> transferCash(from, to, ((CashGood) good).getAmount());
        }
    }

    /**
     * The asset changes hands at fair market value, so its basis steps up to FMV.
     */
    void transferAsset(Network network, Entity from, Entity to, Asset asset) {
        asset.realizeGain();

        to.addDirectAsset(asset);
        propagator.addUpstream(network, to.getName(), List.of(asset));

        from.removeDirectAsset(asset);
        propagator.removeUpstream(network, from.getName(), List.of(asset));

        log.debug("Transferred {} from {} to {}", asset.getName(), from.getName(), to.getName());
    }

    /**
     * Moves the giver's whole interest in {@code downstream}, with its ledger,
     * to the receiver. The edge is re-pointed; if the receiver already holds
     * an interest in the same entity the two interests are merged.
     */
    void transferInterest(Network network, Entity from, Entity to, String downstream) {
        attachInterest(network, to, detachInterest(network, from, downstream));
        log.debug("Transferred interest in {} from {} to {}", downstream, from.getName(), to.getName());
    }

    /**
     * Takes the holder's interest in {@code downstream} out of the graph: its
     * ledger is closed, its mirrors removed upstream and its edge dropped.
     */
    private DetachedInterest detachInterest(Network network, Entity holder, String downstream) {
        PartnershipEdge edge = network.findEdge(holder.getName(), downstream)
            .orElseThrow(() -> SimulationException.insufficientGood(
                holder.getName(), "interest in " + downstream, "no partnership with " + downstream));

        List<PartnershipAsset> positions = holder.closeLedger(downstream);
        propagator.removeUpstream(network, holder.getName(), positions);
        network.removeEdge(edge);
        return new DetachedInterest(downstream, edge.getShare(), positions);
    }

    /**
     * Gives a detached interest to {@code receiver}, merging it with an
     * interest the receiver already holds in the same entity.
     */
    private void attachInterest(Network network, Entity receiver, DetachedInterest interest) {
        String downstream = interest.getDownstream();
        List<PartnershipAsset> positions = interest.getPositions();

        Optional<PartnershipEdge> existing = network.findEdge(receiver.getName(), downstream);
        if (existing.isPresent()) {
            List<PartnershipAsset> current = receiver.closeLedger(downstream);
            propagator.removeUpstream(network, receiver.getName(), current);

            BigDecimal combinedShare = existing.get().getShare().add(interest.getShare());
            network.replaceEdge(existing.get(), existing.get().withShare(combinedShare));
            positions = merge(current, existing.get().getShare(), positions, interest.getShare(), combinedShare);
            log.debug("Merged interest in {} held by {} into a {} share", downstream, receiver.getName(), combinedShare);
        } else {
            network.addEdge(new PartnershipEdge(receiver.getName(), downstream, interest.getShare()));
        }

        receiver.openLedger(downstream);
        positions.forEach(position -> receiver.addToLedger(downstream, position));
        propagator.addUpstream(network, receiver.getName(), positions);
    }

    void transferCash(Entity from, Entity to, BigDecimal amount) {
        from.debit(amount);
        to.credit(amount);
        log.debug("Transferred cash {} from {} to {}", amount, from.getName(), to.getName());
    }

    /**
     * Combines two ledgers over the same downstream entity, position by
     * position (matched by mirrored holding). Inside basis adds up; a
     * position present on one side only takes the proportional basis for the
     * other side's share.
     */
    private List<PartnershipAsset> merge(List<PartnershipAsset> held, BigDecimal heldShare,
                                         List<PartnershipAsset> incoming, BigDecimal incomingShare,
                                         BigDecimal combinedShare) {
        List<PartnershipAsset> merged = new ArrayList<>();
        List<PartnershipAsset> unmatched = new ArrayList<>(incoming);
        for (PartnershipAsset position : held) {
            Holding source = position.getSource();
            Optional<PartnershipAsset> counterpart = unmatched.stream()
                .filter(candidate -> candidate.mirrors(source))
                .findFirst();
            counterpart.ifPresent(unmatched::remove);
            BigDecimal otherBasis = counterpart
                .map(PartnershipAsset::getInsideBasis)
                .orElseGet(() -> source.getMirroredBasis().multiply(incomingShare));
            merged.add(new PartnershipAsset(source, combinedShare, position.getInsideBasis().add(otherBasis)));
        }
        for (PartnershipAsset position : unmatched) {
            Holding source = position.getSource();
            BigDecimal otherBasis = source.getMirroredBasis().multiply(heldShare);
            merged.add(new PartnershipAsset(source, combinedShare, position.getInsideBasis().add(otherBasis)));
        }
        return merged;
    }

    @Value
    private static class DetachedInterest {
        String downstream;
        BigDecimal share;
        List<PartnershipAsset> positions;
    }
}
