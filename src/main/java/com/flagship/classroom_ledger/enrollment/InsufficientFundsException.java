package com.flagship.classroom_ledger.enrollment;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * The subject's available checking balance does not cover the first premium.
 */
@Getter
public class InsufficientFundsException extends RuntimeException {

    private final UUID subjectId;
    private final BigDecimal available;
    private final BigDecimal required;

    public InsufficientFundsException(UUID subjectId, BigDecimal available, BigDecimal required) {
        super(String.format("Available checking balance %s does not cover the premium of %s", available, required));
        this.subjectId = subjectId;
        this.available = available;
        this.required = required;
    }
}
