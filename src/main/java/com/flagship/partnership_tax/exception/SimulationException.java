package com.flagship.partnership_tax.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a network configuration or a transaction is rejected.
 *
 * Always thrown before the caller's network is modified, so the caller can
 * log the details and keep using the network it passed in.
 */
@Getter
public class SimulationException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, String> details;

    public SimulationException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    public SimulationException(ErrorCode errorCode, String message, Map<String, String> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
            : Map.of();
    }

    public static SimulationException insufficientGood(String entity, String good, String reason) {
        return new SimulationException(ErrorCode.INSUFFICIENT_GOOD,
            String.format("%s cannot give %s: %s", entity, good, reason),
            Map.of("entity", entity, "good", good, "reason", reason));
    }

    public static SimulationException unknownEntity(String name) {
        return new SimulationException(ErrorCode.UNKNOWN_ENTITY,
            "Entity not found: " + name, Map.of("entity", name));
    }

    public static SimulationException unknownAsset(String name) {
        return new SimulationException(ErrorCode.UNKNOWN_ASSET,
            "Asset not found: " + name, Map.of("asset", name));
    }

    public static SimulationException cyclicOwnership(String upstream, String downstream) {
        return new SimulationException(ErrorCode.CYCLIC_OWNERSHIP,
            String.format("Ownership cycle: %s would own %s, which already owns it", upstream, downstream),
            Map.of("upstream", upstream, "downstream", downstream));
    }
}
