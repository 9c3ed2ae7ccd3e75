package com.flagship.classroom_ledger.ledger;

import com.flagship.classroom_ledger.tenant.TenantOwned;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A single balance-affecting record.
 *
 * Plain value object read through JDBC. Once written only the void columns
 * ever change, and only from not-voided to voided.
 */
@Value
public class LedgerEntry implements TenantOwned {
    UUID id;
    UUID tenantId;
    UUID subjectId;
    BigDecimal amount;
    AccountBucket bucket;
    EntryKind kind;
    String description;
    Instant createdAt;
    Instant availableAt;
    boolean voided;
    Instant voidedAt;
    UUID voidedBy;
    String idempotencyKey;
    Long sequenceNumber;

    public boolean isAvailableAt(Instant when) {
        return !availableAt.isAfter(when);
    }
}
