package com.flagship.partnership_tax.network;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A legal entity (individual, company, trust) in the ownership network.
 *
 * Holds cash, directly owned assets and one partnership ledger per entity it
 * has an interest in. Ledgers are keyed by the downstream entity's name and
 * list the mirrored positions in insertion order.
 *
 * Entities only expose primitives; keeping ledgers consistent across tiers is
 * the job of the propagation code.
 */
public class Entity {

    @Getter
    private final String name;

    @Getter
    private BigDecimal cashBalance;

    private final Map<String, Asset> directAssets = new LinkedHashMap<>();
    private final Map<String, List<PartnershipAsset>> partnerships = new LinkedHashMap<>();

    public Entity(String name, BigDecimal cashBalance) {
        this.name = Objects.requireNonNull(name);
        this.cashBalance = Objects.requireNonNull(cashBalance);
    }

    // ==================== Cash ====================

    public void credit(BigDecimal amount) {
        cashBalance = cashBalance.add(amount);
    }

    public void debit(BigDecimal amount) {
        cashBalance = cashBalance.subtract(amount);
    }

    public boolean hasCash(BigDecimal amount) {
        return cashBalance.compareTo(amount) >= 0;
    }

    // ==================== Direct assets ====================

    public void addDirectAsset(Asset asset) {
        directAssets.put(asset.getName(), asset);
    }

    public void removeDirectAsset(Asset asset) {
        directAssets.remove(asset.getName());
    }

    public boolean ownsDirectly(Asset asset) {
        return asset.equals(directAssets.get(asset.getName()));
    }

    public Collection<Asset> getDirectAssets() {
        return Collections.unmodifiableCollection(directAssets.values());
    }

    // ==================== Partnership ledgers ====================

    public boolean hasInterestIn(String downstreamName) {
        return partnerships.containsKey(downstreamName);
    }

    /**
     * Positions held through the interest in the given entity, or an empty list.
     */
    public List<PartnershipAsset> getLedger(String downstreamName) {
        return Collections.unmodifiableList(partnerships.getOrDefault(downstreamName, List.of()));
    }

    public Set<String> getPartnershipKeys() {
        return Collections.unmodifiableSet(partnerships.keySet());
    }

    /**
     * Opens an empty ledger for a new interest.
     */
    public void openLedger(String downstreamName) {
        partnerships.putIfAbsent(downstreamName, new ArrayList<>());
    }

    public void addToLedger(String downstreamName, PartnershipAsset position) {
        partnerships.computeIfAbsent(downstreamName, k -> new ArrayList<>()).add(position);
    }

    /**
     * Removes every position in the ledger that mirrors one of the given holdings.
     *
     * @return the removed positions, in ledger order
     */
    public List<PartnershipAsset> removeMirrorsOf(String downstreamName, Collection<? extends Holding> holdings) {
        List<PartnershipAsset> ledger = partnerships.get(downstreamName);
        if (ledger == null) {
            return List.of();
        }
        List<PartnershipAsset> removed = new ArrayList<>();
        ledger.removeIf(position -> {
            boolean match = holdings.stream().anyMatch(position::mirrors);
            if (match) {
                removed.add(position);
            }
            return match;
        });
        return removed;
    }

    /**
     * Finds the position in the ledger that mirrors the given holding.
     */
    public Optional<PartnershipAsset> findMirror(String downstreamName, Holding holding) {
        return partnerships.getOrDefault(downstreamName, List.of()).stream()
            .filter(position -> position.mirrors(holding))
            .findFirst();
    }

    /**
     * Detaches and returns the whole ledger for an interest.
     */
    public List<PartnershipAsset> closeLedger(String downstreamName) {
        List<PartnershipAsset> ledger = partnerships.remove(downstreamName);
        return ledger != null ? ledger : new ArrayList<>();
    }

    /**
     * Everything an upstream partner mirrors: direct assets first, then every
     * ledger position.
     */
    public List<Holding> getHoldings() {
        List<Holding> holdings = new ArrayList<>(directAssets.values());
        partnerships.values().forEach(holdings::addAll);
        return holdings;
    }

    /**
     * Entity with the same name and cash but no holdings; holdings are
     * rebuilt by the network copy.
     */
    Entity emptyCopy() {
        return new Entity(name, cashBalance);
    }

    @Override
    public String toString() {
        return String.format("Entity(%s, cash=%s, directAssets=%s, partnerships=%s)",
            name, cashBalance, directAssets.values(), partnerships);
    }
}
