package com.flagship.classroom_ledger.observability;

import com.flagship.classroom_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges and publish counters. The gauges read cached values that a
 * scheduled pass recomputes, so a Prometheus scrape never queries the outbox.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private static final String PUBLISHED = "classroom.outbox.published";

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong exhausted = new AtomicLong();

    @PostConstruct
    void registerGauges() {
        Gauge.builder("classroom.outbox.pending", pending, AtomicLong::get)
                .description("Claim and ledger events not yet on Kafka")
                .register(meterRegistry);
        Gauge.builder("classroom.outbox.oldest_pending.seconds", oldestPendingSeconds, AtomicLong::get)
                .description("Seconds since the oldest pending event was written")
                .register(meterRegistry);
        Gauge.builder("classroom.outbox.exhausted", exhausted, AtomicLong::get)
                .description("Pending events the publisher has given up on")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            pending.set(outboxRepository.countUnpublished());
            oldestPendingSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(this::secondsSince)
                    .orElse(0L));
            exhausted.set(outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));
            log.debug("Outbox gauges: pending={} oldest={}s exhausted={}",
                    pending.get(), oldestPendingSeconds.get(), exhausted.get());
        } catch (DataAccessException e) {
            // gauges keep their last values until the next pass
            log.warn("Could not refresh outbox gauges: {}", e.getMessage());
        }
    }

    private long secondsSince(Instant createdAt) {
        return Math.max(0, Duration.between(createdAt, clock.instant()).getSeconds());
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter(PUBLISHED, "event_type", eventType, "outcome", "sent").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter(PUBLISHED, "event_type", eventType, "outcome", "failed").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("classroom.outbox.abandoned", "event_type", eventType).increment();
    }
}
