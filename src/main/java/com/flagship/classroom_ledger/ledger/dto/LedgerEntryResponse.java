package com.flagship.classroom_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.classroom_ledger.ledger.AccountBucket;
import com.flagship.classroom_ledger.ledger.EntryKind;
import com.flagship.classroom_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tenant_id")
    UUID tenantId;

    @JsonProperty("subject_id")
    UUID subjectId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("bucket")
    AccountBucket bucket;

    @JsonProperty("kind")
    EntryKind kind;

    @JsonProperty("description")
    String description;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("available_at")
    Instant availableAt;

    @JsonProperty("voided")
    boolean voided;

    @JsonProperty("voided_at")
    Instant voidedAt;

    @JsonProperty("voided_by")
    UUID voidedBy;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .tenantId(entry.getTenantId())
            .subjectId(entry.getSubjectId())
            .amount(entry.getAmount())
            .bucket(entry.getBucket())
            .kind(entry.getKind())
            .description(entry.getDescription())
            .createdAt(entry.getCreatedAt())
            .availableAt(entry.getAvailableAt())
            .voided(entry.isVoided())
            .voidedAt(entry.getVoidedAt())
            .voidedBy(entry.getVoidedBy())
            .sequenceNumber(entry.getSequenceNumber())
            .build();
    }
}
