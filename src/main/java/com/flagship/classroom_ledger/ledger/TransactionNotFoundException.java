package com.flagship.classroom_ledger.ledger;

import lombok.Getter;

import java.util.UUID;

@Getter
public class TransactionNotFoundException extends RuntimeException {

    private final UUID entryId;

    public TransactionNotFoundException(UUID entryId) {
        super("Ledger entry not found: " + entryId);
        this.entryId = entryId;
    }
}
