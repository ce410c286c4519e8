package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.exception.NotFoundException;
import com.flagship.general_ledger.ledger.LedgerService;
import com.flagship.general_ledger.ledger.Voucher;
import com.flagship.general_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Client idempotency keys for voucher creation.
 *
 * The key is stored on the voucher row under a unique constraint, so the database
 * is the source of truth. Redis is a best-effort cache in front of it: any Redis
 * failure falls back to the database, and a cached id is only trusted if the
 * voucher still exists.
 */
@Service
@Slf4j
public class VoucherIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "voucher-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerService ledgerService;
    private final LedgerMetrics metrics;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public VoucherIdempotencyService(LedgerService ledgerService,
                                     LedgerMetrics metrics,
                                     Optional<RedisTemplate<String, String>> redisTemplate) {
        this.ledgerService = ledgerService;
        this.metrics = metrics;
        this.redisTemplate = redisTemplate;
    }

    /**
     * The voucher already created with this key, if any.
     */
    public Optional<Voucher> findExisting(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }

        Optional<Voucher> existing = lookupCached(idempotencyKey)
            .flatMap(this::findVoucher)
            .or(() -> ledgerService.findByIdempotencyKey(idempotencyKey));

        if (existing.isPresent()) {
            metrics.recordIdempotencyHit();
            cache(idempotencyKey, existing.get().getId());
        } else {
            metrics.recordIdempotencyMiss();
        }
        return existing;
    }

    /**
     * Caches the mapping once the creating transaction has committed, so a rolled-back
     * creation never leaves a key pointing at a voucher that does not exist.
     */
    public void rememberAfterCommit(String idempotencyKey, UUID voucherId) {
        if (idempotencyKey == null || idempotencyKey.isBlank() || redisTemplate.isEmpty()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(idempotencyKey, voucherId);
                }
            });
        } else {
            cache(idempotencyKey, voucherId);
        }
    }

    private Optional<UUID> lookupCached(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String voucherId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return Optional.ofNullable(voucherId).map(UUID::fromString);
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Voucher> findVoucher(UUID voucherId) {
        try {
            return Optional.of(ledgerService.getVoucher(voucherId));
        } catch (NotFoundException e) {
            log.warn("Cached idempotency entry points at missing voucher {}, using database", voucherId);
            return Optional.empty();
        }
    }

    private void cache(String idempotencyKey, UUID voucherId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, voucherId.toString(), REDIS_TTL);
        } catch (RuntimeException e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }
}
