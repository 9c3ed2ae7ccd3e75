package com.flagship.classroom_ledger.ledger.event;

import com.flagship.classroom_ledger.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when an entry is voided. Consumers that derived state from the
 * entry (reports, notifications) must treat it as reversed.
 */
@Value
public class LedgerEntryVoidedEvent {
    UUID eventId;
    UUID entryId;
    UUID tenantId;
    UUID subjectId;
    BigDecimal amount;
    String kind;
    UUID voidedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerEntryVoided";

    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerEntryVoidedEvent fromEntry(LedgerEntry entry) {
        return new LedgerEntryVoidedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getTenantId(),
            entry.getSubjectId(),
            entry.getAmount(),
            entry.getKind().name(),
            entry.getVoidedBy(),
            entry.getVoidedAt()
        );
    }
}
