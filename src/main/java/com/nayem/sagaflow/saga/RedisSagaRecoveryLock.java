package com.nayem.sagaflow.saga;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.UUID;

/**
 * {@link SagaRecoveryLock} backed by {@code SET NX PX}. Only the owner that acquired a
 * lock releases it.
 */
public class RedisSagaRecoveryLock implements SagaRecoveryLock {
    private static final String LOCK_PREFIX = "sagaflow:saga:lock:";

    private final StringRedisTemplate redisTemplate;
    private final String owner = UUID.randomUUID().toString();

    public RedisSagaRecoveryLock(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean acquireLock(String lockKey, Duration duration) {
        Boolean success = redisTemplate.opsForValue().setIfAbsent(LOCK_PREFIX + lockKey, owner, duration);
        return success != null && success;
    }

    @Override
    public void releaseLock(String lockKey) {
        String key = LOCK_PREFIX + lockKey;
        if (owner.equals(redisTemplate.opsForValue().get(key))) {
            redisTemplate.delete(key);
        }
    }
}
