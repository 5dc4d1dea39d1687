package com.flagship.partnership_tax.observability;

import java.util.UUID;

/**
 * Thread-local correlation ID and the MDC keys used across the engine.
 *
 * The correlation ID comes from the {@code X-Correlation-ID} header (or is
 * generated) and tags every log line of a request; the simulation ID tags the
 * lines of one sequence run.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String SIMULATION_ID_MDC_KEY = "simulationId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short random ID, readable in logs.
     */
    public static String generateId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
