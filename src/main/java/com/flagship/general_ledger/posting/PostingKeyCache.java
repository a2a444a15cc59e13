package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.ledger.IdempotencyKey;
import com.flagship.general_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Redis fast path for idempotency-key lookups.
 *
 * Strategy:
 * 1. Try Redis first (fast, may be unavailable)
 * 2. On a miss or an error the caller asks the database, which stays the authority
 * 3. Successful postings are written back here, best effort
 *
 * A cached id is only a hint: the engine reloads the entry from the
 * database and checks it still owns the key.
 */
@Component
@Slf4j
public class PostingKeyCache {

    private static final String REDIS_KEY_PREFIX = "ledger:posting-key:";

    private final ObjectProvider<StringRedisTemplate> redisTemplate;
    private final LedgerProperties ledgerProperties;
    private final LedgerMetrics ledgerMetrics;

    public PostingKeyCache(ObjectProvider<StringRedisTemplate> redisTemplate,
                           LedgerProperties ledgerProperties,
                           LedgerMetrics ledgerMetrics) {
        this.redisTemplate = redisTemplate;
        this.ledgerProperties = ledgerProperties;
        this.ledgerMetrics = ledgerMetrics;
    }

    public Optional<UUID> find(IdempotencyKey key) {
        StringRedisTemplate template = template();
        if (template == null) {
            return Optional.empty();
        }
        try {
            String entryId = template.opsForValue().get(REDIS_KEY_PREFIX + key.asString());
            if (entryId != null) {
                ledgerMetrics.recordIdempotencyHit();
                log.debug("Posting key found in Redis: {}", key);
                return Optional.of(UUID.fromString(entryId));
            }
            ledgerMetrics.recordIdempotencyMiss();
        } catch (Exception e) {
            log.warn("Redis lookup failed for posting key {}, falling back to database: {}", key, e.getMessage());
        }
        return Optional.empty();
    }

    public void remember(IdempotencyKey key, UUID entryId) {
        StringRedisTemplate template = template();
        if (template == null) {
            return;
        }
        try {
            template.opsForValue().set(REDIS_KEY_PREFIX + key.asString(), entryId.toString(),
                    ledgerProperties.getIdempotency().getCache().getTtl());
        } catch (Exception e) {
            log.warn("Failed to cache posting key {} in Redis: {}", key, e.getMessage());
        }
    }

    /**
     * Drops a key whose entry was voided so it can be posted again.
     */
    public void forget(IdempotencyKey key) {
        StringRedisTemplate template = template();
        if (template == null) {
            return;
        }
        try {
            template.delete(REDIS_KEY_PREFIX + key.asString());
        } catch (Exception e) {
            log.warn("Failed to evict posting key {} from Redis: {}", key, e.getMessage());
        }
    }

    private StringRedisTemplate template() {
        if (!ledgerProperties.getIdempotency().getCache().isEnabled()) {
            return null;
        }
        return redisTemplate.getIfAvailable();
    }
}
