package com.flagship.crypto_settlement.observability;

import com.flagship.crypto_settlement.mirror.MirrorNodeClient;
import com.flagship.crypto_settlement.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health checks for the settlement service's dependencies.
 */
public class HealthIndicators {

    /**
     * WARNING above 1000 pending sync jobs, DOWN above 10000.
     */
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
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Redis only backs the duplicate-detection fast path, so an outage is
     * DEGRADED rather than DOWN.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                String result = connectionFactory.getConnection().ping();
                return "PONG".equals(result)
                    ? Health.up().withDetail("response", result).build()
                    : Health.down().withDetail("response", String.valueOf(result)).build();
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                .withDetail("error", error)
                .withDetail("note", "Duplicate detection falls back to the database")
                .build();
        }
    }

    /**
     * Mirror node reachability, probed with a one-row transactions page.
     */
    @Component("mirrorNodeHealth")
    public static class MirrorNodeHealthIndicator implements HealthIndicator {

        private final MirrorNodeClient mirrorNodeClient;

        public MirrorNodeHealthIndicator(MirrorNodeClient mirrorNodeClient) {
            this.mirrorNodeClient = mirrorNodeClient;
        }

        @Override
        public Health health() {
            try {
                mirrorNodeClient.ping();
                return Health.up()
                    .withDetail("network", mirrorNodeClient.getNetwork().getId())
                    .withDetail("baseUrl", mirrorNodeClient.getBaseUrl())
                    .build();
            } catch (Exception e) {
                return Health.down()
                    .withDetail("baseUrl", mirrorNodeClient.getBaseUrl())
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
            }
        }
    }
}
