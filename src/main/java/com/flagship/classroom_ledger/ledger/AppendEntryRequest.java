package com.flagship.classroom_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Everything needed to append one ledger entry.
 *
 * {@code availableAt} defaults to the creation time; {@code idempotencyKey}
 * is optional and makes replays return the entry written first.
 */
@Value
@Builder
public class AppendEntryRequest {
    UUID tenantId;
    UUID subjectId;
    BigDecimal amount;
    @Builder.Default
    AccountBucket bucket = AccountBucket.CHECKING;
    EntryKind kind;
    String description;
    Instant availableAt;
    String idempotencyKey;
}
