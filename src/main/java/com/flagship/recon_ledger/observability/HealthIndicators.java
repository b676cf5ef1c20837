package com.flagship.recon_ledger.observability;

import com.flagship.recon_ledger.consistency.ConsistencyChecker;
import com.flagship.recon_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Readiness checks beyond the datasource: outbox backlog, Redis, Kafka and the
 * backlog of blocking consistency checks.
 */
public class HealthIndicators {

    private static final String REDIS_FALLBACK_NOTE = "Run idempotency falls back to the database without Redis";

    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD ? Health.status("WARNING") : Health.down();
                return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
            } catch (RuntimeException e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    /**
     * Blocking checks stop review approvals, so a large backlog is worth surfacing.
     * Never DOWN: the service still works, reviewers are just held up.
     */
    @Component("consistencyHealth")
    public static class ConsistencyHealthIndicator implements HealthIndicator {

        private static final long BLOCKING_WARNING_THRESHOLD = 100;

        private final ConsistencyChecker checker;

        public ConsistencyHealthIndicator(ConsistencyChecker checker) {
            this.checker = checker;
        }

        @Override
        public Health health() {
            try {
                long blocking = checker.countBlocking();
                Health.Builder builder = blocking < BLOCKING_WARNING_THRESHOLD ? Health.up() : Health.status("WARNING");
                return builder
                    .withDetail("blockingChecks", blocking)
                    .withDetail("pendingChecks", checker.countPending())
                    .withDetail("warningThreshold", BLOCKING_WARNING_THRESHOLD)
                    .build();
            } catch (RuntimeException e) {
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
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                    .withDetail("error", "No connection factory configured")
                    .withDetail("note", REDIS_FALLBACK_NOTE)
                    .build();
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.down().withDetail("response", result != null ? result : "null").build();
            } catch (RuntimeException e) {
                return Health.status("DEGRADED")
                    .withDetail("error", describe(e))
                    .withDetail("note", REDIS_FALLBACK_NOTE)
                    .build();
            }
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
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down().withDetail("error", "No Kafka connections established").build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (RuntimeException e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
