package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.exception.IntegrityViolationException;
import lombok.Getter;

import java.util.UUID;

/**
 * A non-rejected claim already references the ledger entry. Raised by the
 * early check and, authoritatively, when the insert hits the
 * uq_claims_active_ledger_entry index.
 */
@Getter
public class TransactionAlreadyClaimedException extends IntegrityViolationException {

    private final UUID ledgerEntryId;

    public TransactionAlreadyClaimedException(UUID ledgerEntryId) {
        super("Ledger entry already has an open or paid claim: " + ledgerEntryId);
        this.ledgerEntryId = ledgerEntryId;
    }

    public TransactionAlreadyClaimedException(UUID ledgerEntryId, Throwable cause) {
        super("Ledger entry already has an open or paid claim: " + ledgerEntryId, cause);
        this.ledgerEntryId = ledgerEntryId;
    }

    @Override
    public String getCode() {
        return "TRANSACTION_ALREADY_CLAIMED";
    }
}
