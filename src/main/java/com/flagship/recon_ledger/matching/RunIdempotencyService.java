package com.flagship.recon_ledger.matching;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps run idempotency keys to run ids.
 *
 * Redis is the fast path; the unique idempotency_key column on reconciliation_runs is
 * the source of truth and is consulted whenever Redis misses or is unavailable.
 */
@Service
@Slf4j
public class RunIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "reconciliation-run:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final ReconciliationRunRepository runRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public RunIdempotencyService(ReconciliationRunRepository runRepository,
                                 Optional<RedisTemplate<String, String>> redisTemplate) {
        this.runRepository = runRepository;
        this.redisTemplate = redisTemplate;
    }

    public Optional<UUID> findRun(String idempotencyKey) {
        requireKey(idempotencyKey);
        String redisKey = REDIS_KEY_PREFIX + idempotencyKey;

        if (redisTemplate.isPresent()) {
            try {
                String runId = redisTemplate.get().opsForValue().get(redisKey);
                if (runId != null) {
                    log.debug("Run idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(runId));
                }
            } catch (DataAccessException e) {
                log.warn("Redis lookup failed for run idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> runId = runRepository.findByIdempotencyKey(idempotencyKey)
            .map(ReconciliationRunEntity::getId);
        runId.ifPresent(id -> cache(redisKey, id));
        return runId;
    }

    public void remember(String idempotencyKey, UUID runId) {
        requireKey(idempotencyKey);
        if (runId == null) {
            throw new IllegalArgumentException("Run ID cannot be null");
        }
        cache(REDIS_KEY_PREFIX + idempotencyKey, runId);
    }

    private void cache(String redisKey, UUID runId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, runId.toString(), REDIS_TTL);
        } catch (DataAccessException e) {
            log.warn("Failed to cache run idempotency key {} in Redis: {}", redisKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
