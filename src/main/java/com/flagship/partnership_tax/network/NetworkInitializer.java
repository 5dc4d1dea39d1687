package com.flagship.partnership_tax.network;

import com.flagship.partnership_tax.exception.ErrorCode;
import com.flagship.partnership_tax.exception.SimulationException;
import com.flagship.partnership_tax.ownership.UpstreamPropagator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a network from its configuration.
 *
 * Ledgers are filled by the same upstream propagation used for transfers, so
 * the result does not depend on the order in which assets and partnerships
 * are declared. Every configuration error is raised before the network is
 * returned; a half-built network never escapes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NetworkInitializer {

    private final UpstreamPropagator propagator;

    public Network initializeNetwork(NetworkConfig config) {
        Network network = new Network();

        for (NetworkConfig.EntitySpec spec : config.getEntities()) {
            addEntity(network, spec.getName(), spec.getCash());
        }
        for (NetworkConfig.AssetSpec spec : config.getAssets()) {
            addAsset(network, spec.getOwner(), spec.getName(), spec.getType(), spec.getBasis(), spec.getFmv());
        }
        for (NetworkConfig.PartnershipSpec spec : config.getPartnerships()) {
            addPartnership(network, spec.getUpstream(), spec.getDownstream(), spec.getShare());
        }

        log.info("Network initialized: entities={}, assets={}, partnerships={}",
            config.getEntities().size(), config.getAssets().size(), config.getPartnerships().size());
        return network;
    }

    public Entity addEntity(Network network, String name, BigDecimal cash) {
        if (network.hasEntity(name)) {
            throw new SimulationException(ErrorCode.DUPLICATE_ENTITY,
                "Entity already exists: " + name, Map.of("entity", name));
        }
        Entity entity = new Entity(name, cash != null ? cash : BigDecimal.ZERO);
        network.addEntity(entity);
        return entity;
    }

    /**
     * Creates an asset owned directly by {@code ownerName} and mirrors it into
     * every partner above the owner.
     */
    public Asset addAsset(Network network, String ownerName, String name, AssetType type,
                          BigDecimal basis, BigDecimal fmv) {
        Entity owner = network.requireEntity(ownerName);
        if (network.hasAsset(name)) {
            throw new SimulationException(ErrorCode.DUPLICATE_ASSET_NAME,
                "Asset name already in use: " + name, Map.of("asset", name, "entity", ownerName));
        }
        Asset asset = Asset.create(name, type, basis, fmv);
        network.registerAsset(asset);
        owner.addDirectAsset(asset);
        propagator.addUpstream(network, ownerName, List.of(asset));
        return asset;
    }

    /**
     * Makes {@code upstreamName} a partner owning {@code share} of
     * {@code downstreamName}. The new partner's ledger mirrors everything the
     * downstream entity holds, and those mirrors are carried further up.
     */
    public PartnershipEdge addPartnership(Network network, String upstreamName, String downstreamName,
                                          BigDecimal share) {
        Entity upstream = network.requireEntity(upstreamName);
        Entity downstream = network.requireEntity(downstreamName);

        if (share == null || share.signum() <= 0 || share.compareTo(BigDecimal.ONE) > 0) {
            throw new SimulationException(ErrorCode.INVALID_SHARE,
                String.format("Share of %s in %s must be in (0, 1]: %s", upstreamName, downstreamName, share),
                Map.of("upstream", upstreamName, "downstream", downstreamName, "share", String.valueOf(share)));
        }
        if (network.findEdge(upstreamName, downstreamName).isPresent()) {
            throw new SimulationException(ErrorCode.DUPLICATE_PARTNERSHIP,
                String.format("%s already holds an interest in %s", upstreamName, downstreamName),
                Map.of("upstream", upstreamName, "downstream", downstreamName));
        }
        BigDecimal allocated = network.allocatedShare(downstreamName).add(share);
        if (allocated.compareTo(BigDecimal.ONE) > 0) {
            throw new SimulationException(ErrorCode.INVALID_SHARE,
                String.format("Partners would own %s of %s", allocated, downstreamName),
                Map.of("upstream", upstreamName, "downstream", downstreamName, "share", share.toPlainString()));
        }
        network.checkAcyclic(upstreamName, downstreamName);

        PartnershipEdge edge = new PartnershipEdge(upstreamName, downstreamName, share);
        network.addEdge(edge);

        upstream.openLedger(downstreamName);
        List<PartnershipAsset> mirrors = new ArrayList<>();
        for (Holding holding : downstream.getHoldings()) {
            PartnershipAsset mirror = PartnershipAsset.mirror(holding, share);
            upstream.addToLedger(downstreamName, mirror);
            mirrors.add(mirror);
        }
        propagator.addUpstream(network, upstreamName, mirrors);
        return edge;
    }
}
