package com.flagship.classroom_ledger.ledger;

import lombok.Getter;

import java.util.UUID;

/**
 * A second void of the same entry. Voiding is deliberately not idempotent so
 * every reversal attempt leaves an audit trace.
 */
@Getter
public class AlreadyVoidedException extends RuntimeException {

    private final UUID entryId;

    public AlreadyVoidedException(UUID entryId) {
        super("Ledger entry already voided: " + entryId);
        this.entryId = entryId;
    }
}
