package com.flagship.classroom_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.classroom_ledger.ledger.AccountBucket;
import com.flagship.classroom_ledger.ledger.EntryKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Request body for appending a ledger entry. The sign rules per kind are
 * checked by the ledger, not here.
 */
@Value
public class CreateLedgerEntryRequest {

    /** Optional; defaults to the tenant of the X-Tenant-ID header. */
    @JsonProperty("tenant_id")
    UUID tenantId;

    @NotNull(message = "Subject ID is required")
    @JsonProperty("subject_id")
    UUID subjectId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("bucket")
    AccountBucket bucket;

    @NotNull(message = "Kind is required")
    @JsonProperty("kind")
    EntryKind kind;

    @Size(max = 255, message = "Description must be at most 255 characters")
    @JsonProperty("description")
    String description;

    @JsonProperty("available_at")
    Instant availableAt;
}
