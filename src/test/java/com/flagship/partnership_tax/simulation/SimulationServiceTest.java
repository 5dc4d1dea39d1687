package com.flagship.partnership_tax.simulation;

import com.flagship.partnership_tax.exception.ErrorCode;
import com.flagship.partnership_tax.exception.SimulationException;
import com.flagship.partnership_tax.network.AssetType;
import com.flagship.partnership_tax.network.NetworkConfig;
import com.flagship.partnership_tax.transaction.AssetGood;
import com.flagship.partnership_tax.transaction.CashGood;
import com.flagship.partnership_tax.transaction.PartnershipInterestGood;
import com.flagship.partnership_tax.transaction.Transaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for running whole transaction sequences.
 *
 * These tests verify that:
 * - The family network example reaches the expected tax records and fitness
 * - Rejected transactions are reported and skipped
 * - An invalid configuration fails the run
 */
@SpringBootTest
class SimulationServiceTest {

    @Autowired
    private SimulationService simulationService;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    /**
     * Mr. Jones owns 0.99 of JonesCo and of FamilyTrust, JonesCo owns 0.99 of
     * NewCo. NewCo holds a hotel; everyone holds promissory notes.
     */
    static NetworkConfig jonesFamily() {
        NetworkConfig.NetworkConfigBuilder builder = NetworkConfig.builder();
        for (String name : List.of("Mr. Jones", "JonesCo", "NewCo", "FamilyTrust", "Mr. Brown")) {
            builder.entity(new NetworkConfig.EntitySpec(name, new BigDecimal("1000000")));
        }
        builder.asset(new NetworkConfig.AssetSpec("NewCo", "Hotel", AssetType.MATERIAL,
            new BigDecimal("120"), new BigDecimal("200")));
        String[][] noteHolders = {
            {"Mr. Jones", "Mr Jones"},
            {"JonesCo", "Jones Co"},
            {"NewCo", "New Co"},
            {"FamilyTrust", "Family Trust"},
            {"Mr. Brown", "Mr Brown"}
        };
        for (String[] holder : noteHolders) {
            for (int i = 1; i <= 3; i++) {
                builder.asset(new NetworkConfig.AssetSpec(holder[0], "Promissory Note " + i + " " + holder[1],
                    AssetType.ANNUITY, new BigDecimal(100 * i), null));
            }
        }
        return builder
            .partnership(new NetworkConfig.PartnershipSpec("Mr. Jones", "JonesCo", new BigDecimal("0.99")))
            .partnership(new NetworkConfig.PartnershipSpec("Mr. Jones", "FamilyTrust", new BigDecimal("0.99")))
            .partnership(new NetworkConfig.PartnershipSpec("JonesCo", "NewCo", new BigDecimal("0.99")))
            .build();
    }

    static List<Transaction> jonesFamilySequence() {
        return List.of(
            Transaction.builder()
                .entityFrom("JonesCo")
                .entityTo("FamilyTrust")
                .goodFrom(new PartnershipInterestGood("NewCo"))
                .goodTo(new AssetGood("Promissory Note 2 Family Trust"))
                .build(),
            Transaction.builder()
                .entityFrom("NewCo")
                .entityTo("Mr. Brown")
                .goodFrom(new AssetGood("Hotel"))
                .goodTo(CashGood.of("200"))
                .build());
    }

    @Test
    @DisplayName("Family network: interest moved to the trust, then the hotel sold")
    void testJonesFamilySequence() {
        printTestHeader("Jones Family Sequence");

        // When
        SimulationResult result = simulationService.run(jonesFamily(), jonesFamilySequence());
        printOutput("Tax records", result.getTaxRecords());
        printOutput("Fitness", result.getFitness());

        // Then
        assertEquals(2, result.appliedCount());
        assertAmount("0.792", result.getTaxRecords().get("JonesCo"));
        assertAmount("156.816", result.getTaxRecords().get("Mr. Jones"));
        assertAmount("0.8", result.getTaxRecords().get("NewCo"));
        assertAmount("0.792", result.getTaxRecords().get("FamilyTrust"));
        assertAmount("159.2", result.getTotalTax());
        assertAmount("5000000", result.getTotalCash());
        assertAmount("4999840.8", result.getFitness());

        // The trust now holds JonesCo's former interest in NewCo
        assertTrue(result.getNetwork().findEdge("FamilyTrust", "NewCo").isPresent());
        assertTrue(result.getNetwork().findEdge("JonesCo", "NewCo").isEmpty());
        assertTrue(result.getNetwork().requireEntity("Mr. Brown")
            .ownsDirectly(result.getNetwork().requireAsset("Hotel")));
        assertAmount("1000200", result.getCashBalances().get("NewCo"));
    }

    @Test
    @DisplayName("A rejected transaction is reported and the rest of the sequence still runs")
    void testRejectedTransactionSkipped() {
        // Given: the hotel is sold before NewCo could pay for a second one
        List<Transaction> transactions = List.of(
            Transaction.builder()
                .entityFrom("Mr. Brown")
                .entityTo("NewCo")
                .goodFrom(CashGood.of("5000000"))
                .goodTo(new AssetGood("Hotel"))
                .build(),
            jonesFamilySequence().get(1));

        // When
        SimulationResult result = simulationService.run(jonesFamily(), transactions);

        // Then
        assertEquals(2, result.getOutcomes().size());
        TransactionOutcome rejected = result.getOutcomes().get(0);
        assertFalse(rejected.isApplied());
        assertEquals(ErrorCode.INSUFFICIENT_GOOD, rejected.getErrorCode());
        assertEquals("Mr. Brown", rejected.getDetails().get("entity"));
        assertAmount("5000000", rejected.getFitnessAfter());

        assertTrue(result.getOutcomes().get(1).isApplied());
        assertEquals(1, result.appliedCount());
    }

    @Test
    @DisplayName("An empty sequence scores the initial network")
    void testEmptySequence() {
        SimulationResult result = simulationService.run(jonesFamily(), List.of());

        assertTrue(result.getOutcomes().isEmpty());
        assertTrue(result.getTaxRecords().isEmpty());
        assertAmount("5000000", result.getFitness());
    }

    @Test
    @DisplayName("An invalid configuration fails the whole run")
    void testInvalidConfiguration() {
        NetworkConfig config = NetworkConfig.builder()
            .entity(new NetworkConfig.EntitySpec("A", BigDecimal.ONE))
            .partnership(new NetworkConfig.PartnershipSpec("A", "Missing", new BigDecimal("0.5")))
            .build();

        SimulationException e = assertThrows(SimulationException.class,
            () -> simulationService.run(config, List.of()));

        assertEquals(ErrorCode.UNKNOWN_ENTITY, e.getErrorCode());
    }
}
