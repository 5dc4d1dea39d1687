package com.flagship.partnership_tax.basis;

import com.flagship.partnership_tax.network.AssetType;
import com.flagship.partnership_tax.network.Network;
import com.flagship.partnership_tax.network.NetworkConfig;
import com.flagship.partnership_tax.network.NetworkInitializer;
import com.flagship.partnership_tax.network.PartnershipAsset;
import com.flagship.partnership_tax.transaction.AssetGood;
import com.flagship.partnership_tax.transaction.CashGood;
import com.flagship.partnership_tax.transaction.PartnershipInterestGood;
import com.flagship.partnership_tax.transaction.Transaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Section 754 / substantial built-in loss basis adjustments.
 *
 * These tests verify that:
 * - An election or a loss strictly above the threshold triggers the adjustment
 * - The adjusted inside basis reaches every upstream tier
 * - Fair market values never change
 * - Excluded asset types do not count towards the built-in loss
 */
@SpringBootTest
class BasisAdjustmentServiceTest {

    @Autowired
    private BasisAdjustmentService basisAdjustmentService;

    @Autowired
    private NetworkInitializer initializer;

    private static NetworkConfig.EntitySpec entity(String name, String cash) {
        return new NetworkConfig.EntitySpec(name, new BigDecimal(cash));
    }

    private static NetworkConfig.PartnershipSpec partnership(String upstream, String downstream, String share) {
        return new NetworkConfig.PartnershipSpec(upstream, downstream, new BigDecimal(share));
    }

    /**
     * R owns half of S, S owns all of P, P holds a plant with the given basis
     * and an FMV of 750,000. Q is a cash buyer.
     */
    private Network lossNetwork(String plantBasis, AssetType plantType) {
        return initializer.initializeNetwork(NetworkConfig.builder()
            .entity(entity("R", "0"))
            .entity(entity("S", "0"))
            .entity(entity("P", "0"))
            .entity(entity("Q", "2000000"))
            .asset(new NetworkConfig.AssetSpec("P", "Plant", plantType,
                new BigDecimal(plantBasis), new BigDecimal("750000")))
            .partnership(partnership("S", "P", "1.0"))
            .partnership(partnership("R", "S", "0.5"))
            .build());
    }

    private static Transaction sellInterest(String seller, String downstream, String buyer, String price,
                                            boolean election) {
        return Transaction.builder()
            .entityFrom(seller)
            .entityTo(buyer)
            .goodFrom(new PartnershipInterestGood(downstream))
            .goodTo(CashGood.of(price))
            .section754Election(election)
            .build();
    }

    @Test
    @DisplayName("A built-in loss equal to the threshold does not trigger an adjustment")
    void testLossAtThresholdDoesNotTrigger() {
        // Given: loss of exactly 250,000 on S's interest in P
        Network network = lossNetwork("1000000", AssetType.MATERIAL);

        // When
        boolean adjusted = basisAdjustmentService.maybeAdjustBasis(network,
            sellInterest("S", "P", "Q", "800000", false));

        // Then
        assertFalse(adjusted);
        assertEquals(0, new BigDecimal("1000000").compareTo(
            network.requireEntity("S").getLedger("P").get(0).getInsideBasis()));
    }

    @Test
    @DisplayName("A built-in loss above the threshold steps inside basis to the price received")
    void testSubstantialLossTriggers() {
        // Given: loss of 250,001
        Network network = lossNetwork("1000001", AssetType.MATERIAL);
        assertEquals(0, new BigDecimal("250001").compareTo(basisAdjustmentService.builtInLoss(network,
            network.requireEntity("S"), new PartnershipInterestGood("P"))));

        // When
        boolean adjusted = basisAdjustmentService.maybeAdjustBasis(network,
            sellInterest("S", "P", "Q", "800000", false));

        // Then
        assertTrue(adjusted);
        PartnershipAsset position = network.requireEntity("S").getLedger("P").get(0);
        assertEquals(0, new BigDecimal("800000").compareTo(position.getInsideBasis()));
        assertEquals(0, new BigDecimal("750000").compareTo(position.getFmv()));

        // R holds half of S, so its mirror follows at half the new basis
        PartnershipAsset upstream = network.requireEntity("R").getLedger("S").get(0);
        assertEquals(0, new BigDecimal("400000").compareTo(upstream.getInsideBasis()));
        assertEquals(0, new BigDecimal("375000").compareTo(upstream.getFmv()));

        // The asset itself is left alone
        assertEquals(0, new BigDecimal("1000001").compareTo(network.requireAsset("Plant").getBasis()));
    }

    @Test
    @DisplayName("Excluded asset types do not count towards the built-in loss")
    void testExcludedTypeIgnoredForLoss() {
        Network network = lossNetwork("5000000", AssetType.ANNUITY);

        assertEquals(0, BigDecimal.ZERO.compareTo(basisAdjustmentService.builtInLoss(network,
            network.requireEntity("S"), new PartnershipInterestGood("P"))));
        assertFalse(basisAdjustmentService.maybeAdjustBasis(network,
            sellInterest("S", "P", "Q", "800000", false)));
    }

    @Test
    @DisplayName("A Section 754 election on an interest transfer triggers an adjustment without any loss")
    void testElectionTriggers() {
        // Given: A owns 0.99 of B, B holds X with a built-in gain
        Network network = initializer.initializeNetwork(NetworkConfig.builder()
            .entity(entity("A", "0"))
            .entity(entity("B", "0"))
            .entity(entity("C", "1000"))
            .asset(new NetworkConfig.AssetSpec("B", "X", AssetType.MATERIAL, new BigDecimal("100"), new BigDecimal("500")))
            .partnership(partnership("A", "B", "0.99"))
            .build());

        // When: without the election nothing happens
        assertFalse(basisAdjustmentService.maybeAdjustBasis(network, sellInterest("A", "B", "C", "600", false)));
        assertEquals(0, new BigDecimal("99").compareTo(network.requireEntity("A").getLedger("B").get(0).getInsideBasis()));

        // When: with the election
        assertTrue(basisAdjustmentService.maybeAdjustBasis(network, sellInterest("A", "B", "C", "600", true)));

        // Then
        assertEquals(0, new BigDecimal("600").compareTo(network.requireEntity("A").getLedger("B").get(0).getInsideBasis()));
    }

    @Test
    @DisplayName("An election on a plain asset sale has nothing to adjust")
    void testElectionWithoutInterestIgnored() {
        Network network = initializer.initializeNetwork(NetworkConfig.builder()
            .entity(entity("A", "0"))
            .entity(entity("B", "1000"))
            .asset(new NetworkConfig.AssetSpec("A", "X", AssetType.MATERIAL, new BigDecimal("100"), new BigDecimal("500")))
            .build());

        Transaction transaction = Transaction.builder()
            .entityFrom("A")
            .entityTo("B")
            .goodFrom(new AssetGood("X"))
            .goodTo(CashGood.of("500"))
            .section754Election(true)
            .build();

        assertFalse(basisAdjustmentService.maybeAdjustBasis(network, transaction));
    }

    @Test
    @DisplayName("A substantial loss on the asset received triggers adjustment of the interest given")
    void testAssetLossOnOtherLegTriggers() {
        // Given: Q hands over a lot with a 400,000 built-in loss for S's interest in P
        Network network = initializer.initializeNetwork(NetworkConfig.builder()
            .entity(entity("S", "0"))
            .entity(entity("P", "0"))
            .entity(entity("Q", "0"))
            .asset(new NetworkConfig.AssetSpec("P", "Plant", AssetType.MATERIAL, new BigDecimal("100"), new BigDecimal("300")))
            .asset(new NetworkConfig.AssetSpec("Q", "Lot", AssetType.REAL_ESTATE, new BigDecimal("900000"), new BigDecimal("500000")))
            .partnership(partnership("S", "P", "1.0"))
            .build());

        Transaction transaction = Transaction.builder()
            .entityFrom("S")
            .entityTo("Q")
            .goodFrom(new PartnershipInterestGood("P"))
            .goodTo(new AssetGood("Lot"))
            .build();

        // When
        assertTrue(basisAdjustmentService.maybeAdjustBasis(network, transaction));

        // Then: S's position takes the basis of the lot
        assertEquals(0, new BigDecimal("900000").compareTo(network.requireEntity("S").getLedger("P").get(0).getInsideBasis()));
    }

    @Test
    @DisplayName("Diamond: adjusting one path leaves the common ancestor's other path alone")
    void testDiamondPathIndependence() {
        // Given: A owns half of B and half of C, both own half of D, D holds X
        Network network = initializer.initializeNetwork(NetworkConfig.builder()
            .entity(entity("A", "0"))
            .entity(entity("B", "0"))
            .entity(entity("C", "0"))
            .entity(entity("D", "0"))
            .entity(entity("E", "1000"))
            .asset(new NetworkConfig.AssetSpec("D", "X", AssetType.MATERIAL, new BigDecimal("100"), new BigDecimal("300")))
            .partnership(partnership("A", "B", "0.5"))
            .partnership(partnership("A", "C", "0.5"))
            .partnership(partnership("B", "D", "0.5"))
            .partnership(partnership("C", "D", "0.5"))
            .build());

        // When: B sells its interest in D to E under an election
        assertTrue(basisAdjustmentService.maybeAdjustBasis(network, sellInterest("B", "D", "E", "40", true)));

        // Then
        assertEquals(0, new BigDecimal("40").compareTo(network.requireEntity("B").getLedger("D").get(0).getInsideBasis()));
        assertEquals(0, new BigDecimal("20").compareTo(network.requireEntity("A").getLedger("B").get(0).getInsideBasis()));
        assertEquals(0, new BigDecimal("25").compareTo(network.requireEntity("A").getLedger("C").get(0).getInsideBasis()));
        assertEquals(0, new BigDecimal("50").compareTo(network.requireEntity("C").getLedger("D").get(0).getInsideBasis()));
    }
}
