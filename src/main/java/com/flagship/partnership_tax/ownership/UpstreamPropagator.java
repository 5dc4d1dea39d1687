package com.flagship.partnership_tax.ownership;

import com.flagship.partnership_tax.exception.SimulationException;
import com.flagship.partnership_tax.network.Entity;
import com.flagship.partnership_tax.network.Holding;
import com.flagship.partnership_tax.network.Network;
import com.flagship.partnership_tax.network.PartnershipAsset;
import com.flagship.partnership_tax.network.PartnershipEdge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps partnership ledgers consistent when an entity's holdings change.
 *
 * Every walk goes strictly upward along the partnership edges and fans out
 * to every partner. Each walk tracks the entities on the current path, so a
 * cycle in the graph raises {@code CYCLIC_OWNERSHIP} instead of recursing
 * forever. Diamonds are fine: an owner reached by two paths is visited once
 * per path.
 */
@Component
@Slf4j
public class UpstreamPropagator {

    /**
     * Mirrors newly held holdings of {@code entityName} into every partner's
     * ledger, scaled by the partner's share, and on up the chain.
     */
    public void addUpstream(Network network, String entityName, List<? extends Holding> added) {
        addUpstream(network, entityName, added, new LinkedHashSet<>());
    }

    /**
     * Deletes the mirrors of removed holdings of {@code entityName} from every
     * partner's ledger, and on up the chain. Mirrors are matched by the
     * identity of the holding they mirror, never by value.
     */
    public void removeUpstream(Network network, String entityName, Collection<? extends Holding> removed) {
        removeUpstream(network, entityName, removed, new LinkedHashSet<>());
    }

    /**
     * Recomputes the inside basis of every mirror of the given positions as
     * {@code source.insideBasis * share}, tier by tier up to the roots.
     *
     * @return number of mirrors updated
     */
    public int propagateInsideBasis(Network network, String entityName, List<PartnershipAsset> changed) {
        return propagateInsideBasis(network, entityName, changed, new LinkedHashSet<>());
    }

    private void addUpstream(Network network, String entityName, List<? extends Holding> added, Set<String> path) {
        if (added.isEmpty()) {
            return;
        }
        path.add(entityName);
        for (PartnershipEdge edge : network.getUpstreamEdges(entityName)) {
            Entity partner = enter(network, edge, path);
            List<PartnershipAsset> mirrors = new ArrayList<>(added.size());
            for (Holding holding : added) {
                PartnershipAsset mirror = PartnershipAsset.mirror(holding, edge.getShare());
                partner.addToLedger(entityName, mirror);
                mirrors.add(mirror);
            }
            log.trace("Mirrored {} holding(s) of {} into {}", mirrors.size(), entityName, partner.getName());
            addUpstream(network, partner.getName(), mirrors, path);
        }
        path.remove(entityName);
    }

    private void removeUpstream(Network network, String entityName, Collection<? extends Holding> removed,
                                Set<String> path) {
        if (removed.isEmpty()) {
            return;
        }
        path.add(entityName);
        for (PartnershipEdge edge : network.getUpstreamEdges(entityName)) {
            Entity partner = enter(network, edge, path);
            List<PartnershipAsset> removedMirrors = partner.removeMirrorsOf(entityName, removed);
            log.trace("Removed {} mirror(s) of {} from {}", removedMirrors.size(), entityName, partner.getName());
            removeUpstream(network, partner.getName(), removedMirrors, path);
        }
        path.remove(entityName);
    }

    private int propagateInsideBasis(Network network, String entityName, List<PartnershipAsset> changed,
                                     Set<String> path) {
        if (changed.isEmpty()) {
            return 0;
        }
        int updated = 0;
        path.add(entityName);
        for (PartnershipEdge edge : network.getUpstreamEdges(entityName)) {
            Entity partner = enter(network, edge, path);
            List<PartnershipAsset> mirrors = new ArrayList<>();
            for (PartnershipAsset position : changed) {
                partner.findMirror(entityName, position).ifPresent(mirror -> {
                    mirror.setInsideBasis(position.getInsideBasis().multiply(edge.getShare()));
                    mirrors.add(mirror);
                });
            }
            updated += mirrors.size();
            updated += propagateInsideBasis(network, partner.getName(), mirrors, path);
        }
        path.remove(entityName);
        return updated;
    }

    private Entity enter(Network network, PartnershipEdge edge, Set<String> path) {
        if (path.contains(edge.getUpstream())) {
            throw SimulationException.cyclicOwnership(edge.getUpstream(), edge.getDownstream());
        }
        return network.requireEntity(edge.getUpstream());
    }
}
