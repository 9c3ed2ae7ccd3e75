package com.flagship.classroom_ledger.ledger;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Amount missing, zero, or of the wrong sign for the entry kind.
 */
@Getter
public class InvalidAmountException extends RuntimeException {

    private final EntryKind kind;
    private final BigDecimal amount;

    public InvalidAmountException(EntryKind kind, BigDecimal amount) {
        super(String.format("Amount %s is not valid for entry kind %s (%s)",
                amount, kind, kind != null ? kind.amountRule() : "n/a"));
        this.kind = kind;
        this.amount = amount;
    }
}
