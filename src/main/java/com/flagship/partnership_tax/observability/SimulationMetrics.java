package com.flagship.partnership_tax.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Centralized metrics for the simulation engine.
 *
 * Metrics exposed:
 * - simulation.transactions.applied: Counter of applied transactions
 * - simulation.transactions.rejected: Counter of rejected transactions, tagged by error code
 * - simulation.basis.adjustments: Counter of triggered basis adjustments
 * - simulation.tax.recorded: Summary of tax recorded per transaction
 * - simulation.transaction.duration: Timer for applyTransaction
 * - simulation.runs: Counter of sequence runs
 */
@Component
public class SimulationMetrics {

    private final MeterRegistry registry;

    private final Counter transactionsApplied;
    private final Counter basisAdjustments;
    private final Counter runs;
    private final DistributionSummary taxRecorded;
    private final Timer transactionTimer;

    public SimulationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.transactionsApplied = Counter.builder("simulation.transactions.applied")
                .description("Number of transactions applied to a network")
                .register(registry);

        this.basisAdjustments = Counter.builder("simulation.basis.adjustments")
                .description("Number of transactions that triggered a basis adjustment")
                .register(registry);

        this.runs = Counter.builder("simulation.runs")
                .description("Number of transaction sequences evaluated")
                .register(registry);

        this.taxRecorded = DistributionSummary.builder("simulation.tax.recorded")
                .description("Tax liability recorded per applied transaction")
                .register(registry);

        this.transactionTimer = Timer.builder("simulation.transaction.duration")
                .description("Time taken to apply one transaction")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordTransactionApplied(BigDecimal tax, Duration duration) {
        transactionsApplied.increment();
        taxRecorded.record(tax.doubleValue());
        transactionTimer.record(duration);
    }

    /**
     * Records a rejected transaction, tagged with the error code.
     */
    public void recordTransactionRejected(String errorCode) {
        registry.counter("simulation.transactions.rejected",
                "error_code", sanitizeTag(errorCode)
        ).increment();
    }

    public void incrementBasisAdjustments() {
        basisAdjustments.increment();
    }

    public void incrementRuns() {
        runs.increment();
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
