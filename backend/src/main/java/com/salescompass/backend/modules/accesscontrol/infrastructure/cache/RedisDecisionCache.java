package com.salescompass.backend.modules.accesscontrol.infrastructure.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.salescompass.backend.modules.accesscontrol.application.DecisionCache;

/**
 * Decision cache shared across instances through Redis.
 * An unreachable Redis degrades to "always miss": reads return empty, writes and deletes are dropped with a warning.
 */
public class RedisDecisionCache implements DecisionCache {

    private static final Logger log = LoggerFactory.getLogger(RedisDecisionCache.class);

    private static final String GRANTED = "1";
    private static final String DENIED = "0";
    private static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisDecisionCache(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public Optional<Boolean> get(String key) {
        try {
            String value = redisTemplate.opsForValue().get(keyPrefix + key);
            return value == null ? Optional.empty() : Optional.of(GRANTED.equals(value));
        } catch (DataAccessException ex) {
            log.warn("Decision cache read failed for {}; computing fresh", key, ex);
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, boolean granted, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(keyPrefix + key, granted ? GRANTED : DENIED, ttl);
        } catch (DataAccessException ex) {
            log.warn("Decision cache write failed for {}", key, ex);
        }
    }

    @Override
    public void deletePattern(String pattern) {
        ScanOptions options = ScanOptions.scanOptions().match(keyPrefix + pattern).count(SCAN_BATCH).build();
        List<String> keys = new ArrayList<>();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
            if (!keys.isEmpty()) {
                redisTemplate.delete(keys);
            }
        } catch (DataAccessException ex) {
            log.warn("Decision cache invalidation failed for pattern {}", pattern, ex);
        }
    }
}
