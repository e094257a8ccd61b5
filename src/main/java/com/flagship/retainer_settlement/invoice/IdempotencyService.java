package com.flagship.retainer_settlement.invoice;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps invoice-creation {@code Idempotency-Key}s to the invoice they created.
 *
 * Redis is a fast path only. The {@code idempotency_key} column on the invoice is the source
 * of truth, so lookups still work when Redis is down or was flushed.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "invoice-idempotency:";

    private final InvoiceRepository invoiceRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final Duration ttl;

    public IdempotencyService(InvoiceRepository invoiceRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate,
                              @Value("${invoices.idempotency.ttl-days:7}") long ttlDays) {
        this.invoiceRepository = invoiceRepository;
        this.redisTemplate = redisTemplate;
        this.ttl = Duration.ofDays(ttlDays);
    }

    /**
     * @return the invoice created earlier with this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> invoiceId = invoiceRepository.findByIdempotencyKey(idempotencyKey).map(InvoiceEntity::getId);
        invoiceId.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return invoiceId;
    }

    /**
     * Caches the mapping in Redis. The database copy is written with the invoice itself.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID invoiceId) {
        requireKey(idempotencyKey);
        if (invoiceId == null) {
            throw new IllegalArgumentException("Invoice ID cannot be null");
        }
        cache(idempotencyKey, invoiceId);
    }

    /**
     * Drops the cached key of an invoice about to be deleted. The database copy goes with the row.
     */
    public void forgetInvoice(UUID invoiceId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        invoiceRepository.findById(invoiceId)
                .map(InvoiceEntity::getIdempotencyKey)
                .ifPresent(this::forgetKey);
    }

    /**
     * Removes a key from Redis. A failure is logged; the database copy keeps lookups correct.
     */
    public void forgetKey(String idempotencyKey) {
        requireKey(idempotencyKey);
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().delete(REDIS_KEY_PREFIX + idempotencyKey);
        } catch (RuntimeException e) {
            log.warn("Failed to evict idempotency key {} from Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private void cache(String idempotencyKey, UUID invoiceId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, invoiceId.toString(), ttl);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
