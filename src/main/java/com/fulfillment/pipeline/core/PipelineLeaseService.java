package com.fulfillment.pipeline.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Marks an order's pipeline run as active in Redis so recovery and manual re-dispatch do not start
 * a second concurrent run. Redis outages fail open: the run proceeds without a lease and the
 * orchestrator's idempotent steps and conditional writes keep it correct.
 */
@Slf4j
@Service
public class PipelineLeaseService {

    private static final String KEY_PREFIX = "fulfillment:lease:";

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public PipelineLeaseService(StringRedisTemplate redisTemplate,
                                @Value("${fulfillment.lease.ttl:10m}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    public Lease tryAcquire(String orderId) {
        String token = UUID.randomUUID().toString();
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + orderId, token, ttl);
            if (Boolean.TRUE.equals(acquired)) {
                return new Lease(orderId, token, true);
            }
            log.info("Pipeline already running elsewhere: orderId={}", orderId);
            return new Lease(orderId, null, false);
        } catch (Exception e) {
            log.warn("Lease acquire failed for orderId={} (Redis unavailable), proceeding without lease: {}",
                    orderId, e.getMessage());
            return new Lease(orderId, null, true);
        }
    }

    public void release(Lease lease) {
        if (lease == null || lease.getToken() == null) {
            return;
        }
        try {
            redisTemplate.execute(RELEASE_SCRIPT, List.of(KEY_PREFIX + lease.getOrderId()), lease.getToken());
        } catch (Exception e) {
            log.warn("Lease release failed for orderId={}, it will expire after {}: {}",
                    lease.getOrderId(), ttl, e.getMessage());
        }
    }

    /** A pipeline-run lease; {@code token} is null when no Redis key backs it. */
    @lombok.Value
    public static class Lease {
        String orderId;
        String token;
        /** Whether the caller may run the pipeline. */
        boolean acquired;
    }
}
