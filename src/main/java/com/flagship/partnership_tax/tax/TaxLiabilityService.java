package com.flagship.partnership_tax.tax;

import com.flagship.partnership_tax.config.SimulationProperties;
import com.flagship.partnership_tax.exception.SimulationException;
import com.flagship.partnership_tax.network.Asset;
import com.flagship.partnership_tax.network.Entity;
import com.flagship.partnership_tax.network.Holding;
import com.flagship.partnership_tax.network.Network;
import com.flagship.partnership_tax.network.PartnershipAsset;
import com.flagship.partnership_tax.network.PartnershipEdge;
import com.flagship.partnership_tax.transaction.AssetGood;
import com.flagship.partnership_tax.transaction.Good;
import com.flagship.partnership_tax.transaction.PartnershipInterestGood;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the tax due when an entity disposes of a good and attributes it
 * up the ownership chain.
 *
 * Each tier is taxed on the part of the gain it keeps: its retained share
 * (one minus its partners' shares) of the gain on its own position. The rest
 * flows to the partners through their mirrors of the same holdings, and so on
 * to the roots. An owner reached through two independent paths is charged
 * once per path; the amounts add up.
 *
 * Computed amounts are added to the network's tax records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaxLiabilityService {

    private final SimulationProperties properties;

    /**
     * Computes and records the liability arising from {@code seller} giving
     * away {@code good}.
     *
     * @return liability per entity name, in attribution order; empty for cash,
     *         an excluded asset type or an interest with nothing taxable in it
     */
    public Map<String, BigDecimal> computeTax(Network network, Entity seller, Good good) {
        List<? extends Holding> sold = switch (good.getKind()) {
            case ASSET -> soldAsset(network.requireAsset(((AssetGood) good).getAssetName()));
            case PARTNERSHIP_INTEREST -> soldPortfolio(seller, ((PartnershipInterestGood) good).getDownstreamEntity());
            case CASH -> List.of();
        };
        // Nothing taxable is not traversed, so no tier gets even a zero record
        if (sold.isEmpty()) {
            return Map.of();
        }

        Map<String, BigDecimal> liabilities = new LinkedHashMap<>();
        charge(liabilities, seller.getName(), network.retainedShare(seller.getName()).multiply(gain(sold)));
        attributeUpstream(network, seller.getName(), sold, liabilities, new LinkedHashSet<>());

        liabilities.forEach(network::recordTax);
        log.debug("Tax on {} by {}: {}", good.describe(), seller.getName(), liabilities);
        return Collections.unmodifiableMap(liabilities);
    }

    private List<Asset> soldAsset(Asset asset) {
        return properties.isExcluded(asset.getType()) ? List.of() : List.of(asset);
    }

    /**
     * Positions of the interest that count for tax: everything except
     * excluded asset types.
     */
    private List<PartnershipAsset> soldPortfolio(Entity seller, String downstream) {
        return seller.getLedger(downstream).stream()
            .filter(position -> !properties.isExcluded(position.getType()))
            .toList();
    }

    private void attributeUpstream(Network network, String entityName, List<? extends Holding> sold,
                                   Map<String, BigDecimal> liabilities, Set<String> path) {
        path.add(entityName);
        for (PartnershipEdge edge : network.getUpstreamEdges(entityName)) {
            if (path.contains(edge.getUpstream())) {
                throw SimulationException.cyclicOwnership(edge.getUpstream(), entityName);
            }
            Entity partner = network.requireEntity(edge.getUpstream());

            List<PartnershipAsset> mirrors = new ArrayList<>(sold.size());
            for (Holding holding : sold) {
                partner.findMirror(entityName, holding).ifPresent(mirrors::add);
            }

            BigDecimal amount = network.retainedShare(partner.getName()).multiply(gain(mirrors));
            charge(liabilities, partner.getName(), amount);
            attributeUpstream(network, partner.getName(), mirrors, liabilities, path);
        }
        path.remove(entityName);
    }

    /**
     * FMV minus basis, summed; for partnership positions the basis is the
     * inside basis.
     */
    private static BigDecimal gain(List<? extends Holding> holdings) {
        return holdings.stream()
            .map(holding -> holding.getFmv().subtract(holding.getMirroredBasis()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private void charge(Map<String, BigDecimal> liabilities, String entityName, BigDecimal amount) {
        BigDecimal recorded = properties.isRecognizeLosses() ? amount : amount.max(BigDecimal.ZERO);
        liabilities.merge(entityName, recorded, BigDecimal::add);
    }
}
