package com.flagship.classroom_ledger.consumer;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Premium billing outcome published by the billing producer on
 * {@code classroom.billing}.
 */
@Value
public class BillingEvent {

    public static final String PREMIUM_PAID = "PremiumPaid";
    public static final String PREMIUM_MISSED = "PremiumMissed";

    @JsonProperty("eventId")
    UUID eventId;

    @JsonProperty("eventType")
    String eventType;

    @JsonProperty("tenantId")
    UUID tenantId;

    @JsonProperty("enrollmentId")
    UUID enrollmentId;

    @JsonProperty("occurredAt")
    Instant occurredAt;
}
