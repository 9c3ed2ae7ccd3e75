package com.flagship.classroom_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the {@code Idempotency-Key} of a ledger append to the entry it
 * created.
 *
 * Redis is a fast path only. The unique idempotency_key column on
 * ledger_entries is the source of truth, so a Redis outage costs a database
 * lookup and never a duplicate entry.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:ledger:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerService ledgerService;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(LedgerService ledgerService, Optional<StringRedisTemplate> redisTemplate) {
        this.ledgerService = ledgerService;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return id of the entry already written under this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String entryId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (entryId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(entryId));
                }
            } catch (DataAccessException e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = ledgerService.findIdByIdempotencyKey(idempotencyKey);
        stored.ifPresent(entryId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, entryId);
        });
        return stored;
    }

    /**
     * Caches the key in Redis. The database already holds it as part of the
     * entry row.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID entryId) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (entryId == null) {
            throw new IllegalArgumentException("Entry ID cannot be null");
        }
        cache(idempotencyKey, entryId);
    }

    private void cache(String idempotencyKey, UUID entryId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, entryId.toString(), REDIS_TTL);
            log.debug("Cached idempotency key in Redis: {} -> {}", idempotencyKey, entryId);
        } catch (DataAccessException e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }
}
