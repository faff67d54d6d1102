package com.cheflink.agent.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Replays the stored answer when a client resends a run request with the same
 * Idempotency-Key, so tools with side effects (meal plan updates, preference
 * changes) are not applied twice.
 *
 * Key pattern: cheflink:idempotency:{key}, kept for 24 hours.
 * Requests without a key always run fresh.
 */
@Service
@Slf4j
public class IdempotencyService {

    static final String KEY_PREFIX = "cheflink:idempotency:";
    static final Duration TTL = Duration.ofHours(24);
    static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the stored response JSON, or empty when the key is new or its
     *         first request is still running
     */
    public Optional<String> getCachedResponse(String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(idempotencyKey));
        if (existing == null) {
            return Optional.empty();
        }
        if (IN_FLIGHT_SENTINEL.equals(existing)) {
            log.warn("Idempotency key {} is in-flight", idempotencyKey);
            return Optional.empty();
        }
        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(existing);
    }

    /**
     * Marks the key in-flight with SET NX.
     *
     * @return false if another request already holds the key
     */
    public boolean claimKey(String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(buildKey(idempotencyKey), IN_FLIGHT_SENTINEL, TTL);
        return Boolean.TRUE.equals(claimed);
    }

    public void storeResponse(String idempotencyKey, String responseJson) {
        redisTemplate.opsForValue().set(buildKey(idempotencyKey), responseJson, TTL);
        log.debug("Stored idempotency response for key={}", idempotencyKey);
    }

    /** Lets the client retry after a failed request */
    public void releaseKey(String idempotencyKey) {
        redisTemplate.delete(buildKey(idempotencyKey));
        log.debug("Released idempotency key={}", idempotencyKey);
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}
