package com.flagship.partnership_tax.simulation;

import com.flagship.partnership_tax.basis.BasisAdjustmentService;
import com.flagship.partnership_tax.exception.ErrorCode;
import com.flagship.partnership_tax.exception.SimulationException;
import com.flagship.partnership_tax.network.Asset;
import com.flagship.partnership_tax.network.Entity;
import com.flagship.partnership_tax.network.Network;
import com.flagship.partnership_tax.observability.SimulationMetrics;
import com.flagship.partnership_tax.ownership.OwnershipTransferService;
import com.flagship.partnership_tax.tax.TaxLiabilityService;
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
import java.time.Duration;
import java.util.Map;

/**
 * Applies transactions to a network and scores the result.
 *
 * Each transaction runs: viability check, basis adjustment (if triggered),
 * tax for both legs, ownership transfer for both legs. The work is done on a
 * copy of the network, so a transaction either applies completely or leaves
 * the caller's network exactly as it was.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionEngine {

    private final BasisAdjustmentService basisAdjustmentService;
    private final TaxLiabilityService taxLiabilityService;
    private final OwnershipTransferService ownershipTransferService;
    private final SimulationMetrics metrics;

    /**
     * Applies a transaction.
     *
     * @param network network before the transaction; never modified
     * @param transaction the proposed exchange
     * @return a new network reflecting the transaction
     * @throws SimulationException if the transaction is not viable or the
     *         ownership graph turns out to be cyclic
     */
    public Network applyTransaction(Network network, Transaction transaction) {
        long startTime = System.nanoTime();
        try {
            Network next = network.copy();
            Entity from = next.requireEntity(transaction.getEntityFrom());
            Entity to = next.requireEntity(transaction.getEntityTo());

            if (from == to) {
                throw new SimulationException(ErrorCode.INVALID_TRANSACTION,
                    "An entity cannot trade with itself: " + from.getName(),
                    Map.of("entity", from.getName()));
            }

            checkViable(next, from, transaction.getGoodFrom());
            checkViable(next, to, transaction.getGoodTo());
            checkNoCycle(next, to, transaction.getGoodFrom());
            checkNoCycle(next, from, transaction.getGoodTo());

            if (basisAdjustmentService.maybeAdjustBasis(next, transaction)) {
                metrics.incrementBasisAdjustments();
            }

            BigDecimal taxBefore = next.totalTaxLiability();
            taxLiabilityService.computeTax(next, from, transaction.getGoodFrom());
            taxLiabilityService.computeTax(next, to, transaction.getGoodTo());
            BigDecimal tax = next.totalTaxLiability().subtract(taxBefore);

            ownershipTransferService.exchange(next, from, to, transaction.getGoodFrom(), transaction.getGoodTo());

            metrics.recordTransactionApplied(tax, Duration.ofNanos(System.nanoTime() - startTime));
            log.info("Transaction applied: [{}], tax={}", transaction, tax);
            return next;

        } catch (SimulationException e) {
            metrics.recordTransactionRejected(e.getErrorCode().name());
            log.warn("Transaction rejected: [{}], code={}, reason={}",
                transaction, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    /**
     * Total cash across all entities minus total recorded tax liability.
     */
    public BigDecimal fitness(Network network) {
        return network.totalCashBalance().subtract(network.totalTaxLiability());
    }

    /**
     * Checks that the entity actually holds what it is giving.
     */
    void checkViable(Network network, Entity entity, Good good) {
        switch (good.getKind()) {
            case ASSET -> {
                Asset asset = network.requireAsset(((AssetGood) good).getAssetName());
                if (!entity.ownsDirectly(asset)) {
                    throw SimulationException.insufficientGood(entity.getName(), good.describe(),
                        "does not own the asset");
                }
            }
            case PARTNERSHIP_INTEREST -> {
                String downstream = ((PartnershipInterestGood) good).getDownstreamEntity();
                network.requireEntity(downstream);
                if (network.findEdge(entity.getName(), downstream).isEmpty()) {
                    throw SimulationException.insufficientGood(entity.getName(), good.describe(),
                        "has no partnership with " + downstream);
                }
            }
            case CASH -> {
                BigDecimal amount = ((CashGood) good).getAmount();
                if (!entity.hasCash(amount)) {
                    throw SimulationException.insufficientGood(entity.getName(), good.describe(),
                        "cash balance " + entity.getCashBalance().toPlainString() + " is too low");
                }
            }
        }
    }

    /**
     * An interest must not end up owned by the entity itself or by one of
     * the entities it owns.
     */
    private void checkNoCycle(Network network, Entity receiver, Good good) {
        if (good.getKind() == GoodKind.PARTNERSHIP_INTEREST) {
            network.checkAcyclic(receiver.getName(), ((PartnershipInterestGood) good).getDownstreamEntity());
        }
    }
}
