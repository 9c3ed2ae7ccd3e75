package com.flagship.classroom_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Stores claim, ledger and enrollment events in {@code outbox_events} as part
 * of the business transaction that produced them. {@link OutboxPublisher}
 * moves them to Kafka later.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Requires an open transaction: an event must never outlive a rolled-back
     * claim decision or void.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(AggregateType aggregateType, UUID aggregateId, UUID tenantId,
                                 String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, tenantId,
                eventType, toJson(eventType, payload), clock.instant());
        OutboxEvent stored = repository.save(OutboxEventEntity.fromDomain(event)).toDomain();
        log.debug("Queued {} for {} {}", eventType, aggregateType.label(), aggregateId);
        return stored;
    }

    /** Locks up to {@code limit} pending rows; the lock ends with this short transaction. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit) {
        return toDomain(repository.findUnpublishedEventsForUpdate(limit));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId)
                .ifPresent(row -> row.markPublished(clock.instant()));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(row -> {
            row.markFailed(errorMessage);
            log.warn("Outbox event {} failed attempt {}: {}", eventId, row.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(AggregateType aggregateType, UUID aggregateId) {
        return toDomain(repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                aggregateType.label(), aggregateId));
    }

    private static List<OutboxEvent> toDomain(List<OutboxEventEntity> rows) {
        return rows.stream().map(OutboxEventEntity::toDomain).toList();
    }

    private String toJson(String eventType, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + eventType + " payload", e);
        }
    }
}
