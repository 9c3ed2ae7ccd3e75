package com.flagship.classroom_ledger.ledger;

/**
 * Balance bucket a ledger entry is posted to. Balances are derived per
 * bucket.
 */
public enum AccountBucket {
    CHECKING,
    SAVINGS
}
