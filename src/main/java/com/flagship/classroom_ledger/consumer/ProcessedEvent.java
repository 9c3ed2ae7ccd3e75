package com.flagship.classroom_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of an inbound event this service has already handled, so a replay
 * after a crash or rebalance is recognised and skipped.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String detail;

    public enum ProcessingResult {
        /** handler ran and committed */
        SUCCESS,
        /** not applicable (unknown type, cancelled or foreign enrollment); never retried */
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                                         String consumerGroup, Instant processedAt) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup, processedAt,
                ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType, UUID aggregateId,
                                         String consumerGroup, Instant processedAt, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup, processedAt,
                ProcessingResult.SKIPPED, reason);
    }
}
