package com.flagship.classroom_ledger.outbox;

import com.flagship.classroom_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Drains the outbox into Kafka on a fixed schedule.
 *
 * The record key is the aggregate id, so all events of one claim land on one
 * partition in the order they were written. A row is marked published only
 * after the broker acknowledged it. Rows that reached
 * {@code outbox.publisher.max-retries} stay in the table for manual replay.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_ID_HEADER = "event_id";
    static final String EVENT_TYPE_HEADER = "event_type";
    static final String TENANT_ID_HEADER = "tenant_id";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.claims:classroom.claims}")
    private String claimsTopic;

    @Value("${kafka.topic.ledger:classroom.ledger}")
    private String ledgerTopic;

    @Value("${kafka.topic.enrollments:classroom.enrollments}")
    private String enrollmentsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findUnpublishedEvents(batchSize);
        } catch (RuntimeException e) {
            log.error("Outbox poll failed, retrying on next tick", e);
            return;
        }
        if (!batch.isEmpty()) {
            log.debug("Publishing {} outbox events", batch.size());
            batch.forEach(this::publish);
        }
    }

    private void publish(OutboxEvent event) {
        String eventType = event.getEventType();
        if (event.getRetryCount() >= maxRetries) {
            log.warn("Outbox event {} ({} for {}) gave up after {} attempts; needs manual replay",
                    event.getId(), eventType, event.getAggregateId(), event.getRetryCount());
            outboxMetrics.recordEventDeadLettered(eventType);
            return;
        }

        try {
            RecordMetadata metadata = kafkaTemplate.send(toRecord(event)).get().getRecordMetadata();
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(eventType);
            log.debug("Outbox event {} ({}) sent to {}-{}@{}",
                    event.getId(), eventType, metadata.topic(), metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted while waiting for broker ack");
        } catch (ExecutionException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.error("Outbox event {} ({}) not sent: {}", event.getId(), eventType, cause.getMessage());
            recordFailure(event, cause.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String reason) {
        outboxService.markFailed(event.getId(), reason);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
    }

    ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(topicFor(event), event.getAggregateId().toString(), event.getPayload());
        addHeader(record, EVENT_ID_HEADER, event.getId().toString());
        addHeader(record, EVENT_TYPE_HEADER, event.getEventType());
        addHeader(record, TENANT_ID_HEADER, event.getTenantId().toString());
        return record;
    }

    private static void addHeader(ProducerRecord<String, String> record, String name, String value) {
        record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
    }

    String topicFor(OutboxEvent event) {
        return switch (AggregateType.fromLabel(event.getAggregateType())) {
            case CLAIM -> claimsTopic;
            case LEDGER_ENTRY -> ledgerTopic;
            case ENROLLMENT -> enrollmentsTopic;
        };
    }
}
