package com.flagship.partnership_tax.simulation;

import com.flagship.partnership_tax.exception.ErrorCode;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * What happened to one transaction of a sequence.
 */
@Value
public class TransactionOutcome {
    int index;
    String description;
    boolean applied;
    BigDecimal fitnessAfter;
    ErrorCode errorCode;
    String message;
    Map<String, String> details;

    public static TransactionOutcome applied(int index, String description, BigDecimal fitnessAfter) {
        return new TransactionOutcome(index, description, true, fitnessAfter, null, null, Map.of());
    }

    public static TransactionOutcome rejected(int index, String description, BigDecimal fitnessAfter,
                                              ErrorCode errorCode, String message, Map<String, String> details) {
        return new TransactionOutcome(index, description, false, fitnessAfter, errorCode, message, details);
    }
}
