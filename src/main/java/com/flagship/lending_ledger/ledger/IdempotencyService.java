package com.flagship.lending_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps caller-supplied external references to the journal entry they produced.
 *
 * Strategy:
 * 1. Try Redis first (fast, may be unavailable)
 * 2. Fall back to the unique external_reference column (source of truth)
 * 3. Cache in Redis only after the posting transaction has committed
 *
 * A rolled-back posting therefore never leaves a reference behind that
 * would block the caller's retry.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:ref:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final JournalRepository journalRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(JournalRepository journalRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.journalRepository = journalRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the entry already recorded for this reference, if any
     */
    public Optional<UUID> findEntryId(String externalReference) {
        if (externalReference == null || externalReference.isBlank()) {
            throw new IllegalArgumentException("External reference cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + externalReference);
                if (cached != null) {
                    log.debug("External reference found in Redis: {}", externalReference);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for external reference {}, falling back to database: {}",
                        externalReference, e.getMessage());
            }
        }

        Optional<UUID> entryId = journalRepository.findIdByExternalReference(externalReference);
        entryId.ifPresent(id -> cache(externalReference, id));
        return entryId;
    }

    /**
     * Caches the mapping once the current transaction commits; immediately
     * when no transaction is active.
     */
    public void remember(String externalReference, UUID entryId) {
        if (externalReference == null || entryId == null) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(externalReference, entryId);
                }
            });
        } else {
            cache(externalReference, entryId);
        }
    }

    private void cache(String externalReference, UUID entryId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + externalReference, entryId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache external reference in Redis: {}", e.getMessage());
        }
    }
}
