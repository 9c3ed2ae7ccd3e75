package com.flagship.classroom_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.classroom_ledger.enrollment.EnrollmentCancelledException;
import com.flagship.classroom_ledger.enrollment.EnrollmentNotFoundException;
import com.flagship.classroom_ledger.enrollment.EnrollmentService;
import com.flagship.classroom_ledger.observability.ClaimMetrics;
import com.flagship.classroom_ledger.tenant.CrossTenantViolationException;
import com.flagship.classroom_ledger.tenant.TenantScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Applies premium billing outcomes to enrollments.
 *
 * Offsets are committed manually after the event was applied or recorded as
 * skipped. Events that can never apply (unknown type, missing, cancelled or
 * foreign enrollment) are recorded as skipped and acknowledged; anything else
 * is rethrown and redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class BillingEventConsumer {

    static final String CONSUMER_GROUP = "billing-event-consumer";
    private static final String AGGREGATE_TYPE = "Enrollment";

    private final IdempotentEventProcessor eventProcessor;
    private final EnrollmentService enrollmentService;
    private final ClaimMetrics metrics;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.billing:classroom.billing}",
        groupId = "${spring.kafka.consumer.group-id:classroom-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received billing message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        BillingEvent event = parse(record.value());
        if (event == null) {
            log.warn("Unparseable billing event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        handle(event);
        ack.acknowledge();
    }

    /**
     * @return true if the event changed an enrollment
     */
    public boolean handle(BillingEvent event) {
        Runnable handler = switch (event.getEventType()) {
            case BillingEvent.PREMIUM_PAID ->
                () -> enrollmentService.recordPayment(event.getEnrollmentId(), TenantScope.of(event.getTenantId()));
            case BillingEvent.PREMIUM_MISSED ->
                () -> enrollmentService.markUnpaid(event.getEnrollmentId(), TenantScope.of(event.getTenantId()));
            default -> null;
        };

        if (handler == null) {
            skip(event, "Unknown event type");
            return false;
        }

        try {
            boolean processed = eventProcessor.processEvent(event.getEventId(), event.getEventType(),
                    AGGREGATE_TYPE, event.getEnrollmentId(), CONSUMER_GROUP, handler);
            metrics.recordBillingEvent(event.getEventType(), processed);
            if (processed) {
                log.info("Applied billing event: type={}, eventId={}, enrollmentId={}",
                        event.getEventType(), event.getEventId(), event.getEnrollmentId());
            }
            return processed;
        } catch (EnrollmentNotFoundException | EnrollmentCancelledException | CrossTenantViolationException e) {
            log.warn("Billing event {} cannot apply: {}", event.getEventId(), e.getMessage());
            skip(event, e.getMessage());
            return false;
        }
    }

    private void skip(BillingEvent event, String reason) {
        eventProcessor.skipEvent(event.getEventId(), event.getEventType(), AGGREGATE_TYPE,
                event.getEnrollmentId(), CONSUMER_GROUP, reason);
        metrics.recordBillingEvent(event.getEventType(), false);
    }

    private BillingEvent parse(String json) {
        try {
            BillingEvent event = objectMapper.readValue(json, BillingEvent.class);
            if (event.getEventId() == null || event.getEventType() == null
                    || event.getTenantId() == null || event.getEnrollmentId() == null) {
                log.error("Billing event is missing required fields: {}", json);
                return null;
            }
            return event;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse billing event: {}", e.getMessage());
            return null;
        }
    }
}
