package com.flagship.partnership_tax.network;

import com.flagship.partnership_tax.exception.SimulationException;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Root aggregate of a simulation: entities, assets, the partnership edge list
 * and the accumulated tax records.
 *
 * The network owns every entity and asset. Partnership edges live here, not
 * on the entities; an entity's ledger for a downstream entity exists exactly
 * when an edge does.
 *
 * Not thread-safe. Callers evaluating sequences in parallel must give each
 * sequence its own instance (see {@link #copy()}).
 */
public class Network {

    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final Map<String, Asset> assets = new LinkedHashMap<>();
    private final List<PartnershipEdge> edges = new ArrayList<>();
    private final Map<String, BigDecimal> taxRecords = new LinkedHashMap<>();

    // ==================== Entities and assets ====================

    public void addEntity(Entity entity) {
        entities.put(entity.getName(), entity);
    }

    public boolean hasEntity(String name) {
        return entities.containsKey(name);
    }

    public Entity requireEntity(String name) {
        Entity entity = entities.get(name);
        if (entity == null) {
            throw SimulationException.unknownEntity(name);
        }
        return entity;
    }

    public Collection<Entity> getEntities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    public void registerAsset(Asset asset) {
        assets.put(asset.getName(), asset);
    }

    public boolean hasAsset(String name) {
        return assets.containsKey(name);
    }

    public Asset requireAsset(String name) {
        Asset asset = assets.get(name);
        if (asset == null) {
            throw SimulationException.unknownAsset(name);
        }
        return asset;
    }

    public Collection<Asset> getAssets() {
        return Collections.unmodifiableCollection(assets.values());
    }

    // ==================== Ownership graph ====================

    public List<PartnershipEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * Edges pointing into the given entity, i.e. its partners.
     */
    public List<PartnershipEdge> getUpstreamEdges(String downstream) {
        return edges.stream()
            .filter(edge -> edge.getDownstream().equals(downstream))
            .toList();
    }

    public Optional<PartnershipEdge> findEdge(String upstream, String downstream) {
        return edges.stream()
            .filter(edge -> edge.getUpstream().equals(upstream) && edge.getDownstream().equals(downstream))
            .findFirst();
    }

    public void addEdge(PartnershipEdge edge) {
        edges.add(edge);
    }

    public void removeEdge(PartnershipEdge edge) {
        edges.remove(edge);
    }

    /**
     * Replaces an edge in place, keeping its position in the edge list.
     */
    public void replaceEdge(PartnershipEdge current, PartnershipEdge replacement) {
        int index = edges.indexOf(current);
        if (index < 0) {
            edges.add(replacement);
        } else {
            edges.set(index, replacement);
        }
    }

    /**
     * Sum of the shares held by the entity's partners.
     */
    public BigDecimal allocatedShare(String name) {
        return getUpstreamEdges(name).stream()
            .map(PartnershipEdge::getShare)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Fraction of the entity's results it keeps for itself: one minus the
     * shares held by its partners.
     */
    public BigDecimal retainedShare(String name) {
        return BigDecimal.ONE.subtract(allocatedShare(name));
    }

    /**
     * Whether {@code ancestor} owns {@code entity}, directly or through any
     * chain of partnerships. An entity is considered its own ancestor.
     */
    public boolean isAncestor(String ancestor, String entity) {
        Set<String> visited = new HashSet<>();
        Deque<String> frontier = new ArrayDeque<>();
        frontier.push(entity);
        while (!frontier.isEmpty()) {
            String current = frontier.pop();
            if (current.equals(ancestor)) {
                return true;
            }
            if (visited.add(current)) {
                getUpstreamEdges(current).forEach(edge -> frontier.push(edge.getUpstream()));
            }
        }
        return false;
    }

    /**
     * Rejects a new edge {@code upstream -> downstream} that would close a cycle.
     */
    public void checkAcyclic(String upstream, String downstream) {
        if (isAncestor(downstream, upstream)) {
            throw SimulationException.cyclicOwnership(upstream, downstream);
        }
    }

    // ==================== Tax records ====================

    public void recordTax(String name, BigDecimal amount) {
        taxRecords.merge(name, amount, BigDecimal::add);
    }

    public BigDecimal getTaxLiability(String name) {
        return taxRecords.getOrDefault(name, BigDecimal.ZERO);
    }

    public Map<String, BigDecimal> getTaxRecords() {
        return Collections.unmodifiableMap(taxRecords);
    }

    // ==================== Totals ====================

    public BigDecimal totalTaxLiability() {
        return taxRecords.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalCashBalance() {
        return entities.values().stream()
            .map(Entity::getCashBalance)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Sum of FMV over every direct asset and ledger position plus all cash.
     */
    public BigDecimal totalValue() {
        BigDecimal total = totalCashBalance();
        for (Entity entity : entities.values()) {
            for (Holding holding : entity.getHoldings()) {
                total = total.add(holding.getFmv());
            }
        }
        return total;
    }

    // ==================== Copy ====================

    /**
     * Deep copy sharing nothing mutable with this network. Asset ids are
     * kept, so names and ids resolve the same way in both.
     */
    public Network copy() {
        Network copy = new Network();
        Map<Holding, Holding> copies = new IdentityHashMap<>();
        for (Asset asset : assets.values()) {
            Asset assetCopy = asset.copy();
            copy.registerAsset(assetCopy);
            copies.put(asset, assetCopy);
        }
        for (Entity entity : entities.values()) {
            Entity entityCopy = entity.emptyCopy();
            entity.getDirectAssets().forEach(asset -> entityCopy.addDirectAsset((Asset) copies.get(asset)));
            for (String downstream : entity.getPartnershipKeys()) {
                entityCopy.openLedger(downstream);
                for (PartnershipAsset position : entity.getLedger(downstream)) {
                    entityCopy.addToLedger(downstream, (PartnershipAsset) copyHolding(position, copies));
                }
            }
            copy.addEntity(entityCopy);
        }
        copy.edges.addAll(edges);
        copy.taxRecords.putAll(taxRecords);
        return copy;
    }

    private Holding copyHolding(Holding holding, Map<Holding, Holding> copies) {
        Holding existing = copies.get(holding);
        if (existing != null) {
            return existing;
        }
        PartnershipAsset position = (PartnershipAsset) holding;
        PartnershipAsset positionCopy = new PartnershipAsset(
            copyHolding(position.getSource(), copies), position.getShare(), position.getInsideBasis());
        copies.put(position, positionCopy);
        return positionCopy;
    }

    @Override
    public String toString() {
        return String.format("Network(entities=%s, assets=%s, taxRecords=%s)",
            entities.keySet(), assets.keySet(), taxRecords);
    }
}
