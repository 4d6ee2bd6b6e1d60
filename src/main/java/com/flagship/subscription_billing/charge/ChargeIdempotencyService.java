package com.flagship.subscription_billing.charge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.subscription_billing.config.IdempotencyProperties;
import com.flagship.subscription_billing.ledger.Ledger;
import com.flagship.subscription_billing.ledger.LedgerEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Looks up whether an attempt's idempotency key already has a determinate
 * outcome, so a retried attempt replays it instead of charging again.
 *
 * Redis is a fast path only. The ledger is the source of truth: a Redis miss
 * or outage falls through to the ledger, and Redis failures never fail an
 * attempt. Only determinate outcomes are cached; a PENDING attempt must reach
 * the gateway again with the same key.
 */
@Service
@Slf4j
public class ChargeIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "billing:charge:";

    private final Ledger ledger;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final IdempotencyProperties properties;
    private final ObjectMapper objectMapper;

    public ChargeIdempotencyService(Ledger ledger,
                                    Optional<StringRedisTemplate> redisTemplate,
                                    IdempotencyProperties properties,
                                    ObjectMapper objectMapper) {
        this.ledger = ledger;
        this.redisTemplate = redisTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Optional<RecordedOutcome> findRecordedOutcome(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        Optional<LedgerEntry> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key found in Redis: {}", idempotencyKey);
            return Optional.of(new RecordedOutcome(cached.get(), RecordedOutcome.Source.CACHE));
        }

        Optional<LedgerEntry> recorded = ledger.findDeterminateByIdempotencyKey(idempotencyKey);
        if (recorded.isEmpty()) {
            return Optional.empty();
        }

        log.debug("Idempotency key found on ledger: {}", idempotencyKey);
        writeCache(recorded.get());
        return Optional.of(new RecordedOutcome(recorded.get(), RecordedOutcome.Source.LEDGER));
    }

    /**
     * Caches a freshly appended entry. PENDING entries are ignored.
     */
    public void remember(LedgerEntry entry) {
        if (entry.getOutcome().isDeterminate()) {
            writeCache(entry);
        }
    }

    private Optional<LedgerEntry> readCache(String idempotencyKey) {
        if (!cacheAvailable()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, LedgerEntry.class));
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to ledger. Error: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(LedgerEntry entry) {
        if (!cacheAvailable()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(
                REDIS_KEY_PREFIX + entry.getIdempotencyKey(),
                objectMapper.writeValueAsString(entry),
                properties.getTtl()
            );
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private boolean cacheAvailable() {
        return properties.isCacheEnabled() && redisTemplate.isPresent();
    }
}
