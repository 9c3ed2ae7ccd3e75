package com.flagship.classroom_ledger.observability;

import com.flagship.classroom_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator contributors for the pieces the ledger leans on besides PostgreSQL.
 * Redis only backs the idempotency cache, so losing it reports DEGRADED.
 */
public class HealthIndicators {

    private HealthIndicators() {
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long PENDING_WARNING = 1_000;
        static final long PENDING_DOWN = 10_000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long pending = outboxRepository.countUnpublished();
                long abandoned = outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);

                Health.Builder builder;
                if (pending >= PENDING_DOWN) {
                    builder = Health.down();
                } else if (pending >= PENDING_WARNING || abandoned > 0) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }
                return builder
                        .withDetail("pending", pending)
                        .withDetail("abandoned", abandoned)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
            if (factory == null) {
                return degraded("no connection factory");
            }
            try (RedisConnection connection = factory.getConnection()) {
                String reply = connection.ping();
                return "PONG".equals(reply)
                        ? Health.up().build()
                        : degraded("unexpected ping reply " + reply);
            } catch (Exception e) {
                return degraded(describe(e));
            }
        }

        private Health degraded(String reason) {
            return Health.status("DEGRADED")
                    .withDetail("error", reason)
                    .withDetail("fallback", "idempotency keys read from ledger_entries")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                int producerMetrics = kafkaTemplate.metrics().size();
                return producerMetrics > 0
                        ? Health.up().withDetail("producerMetrics", producerMetrics).build()
                        : Health.down().withDetail("error", "producer has not connected").build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }
}
