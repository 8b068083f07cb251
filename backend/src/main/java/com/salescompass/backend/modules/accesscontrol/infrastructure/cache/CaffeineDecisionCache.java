package com.salescompass.backend.modules.accesscontrol.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

import org.springframework.util.PatternMatchUtils;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.salescompass.backend.modules.accesscontrol.application.DecisionCache;

/**
 * In-process decision cache backed by Caffeine with per-entry expiry.
 * Not shared between instances; use {@link RedisDecisionCache} for multi-node deployments.
 */
public class CaffeineDecisionCache implements DecisionCache {

    private final Cache<String, Boolean> cache;
    private final Duration defaultTtl;

    public CaffeineDecisionCache(Duration defaultTtl, long maximumSize) {
        this(defaultTtl, maximumSize, Ticker.systemTicker());
    }

    CaffeineDecisionCache(Duration defaultTtl, long maximumSize, Ticker ticker) {
        this.defaultTtl = defaultTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new WriteExpiry(defaultTtl))
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<Boolean> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, boolean granted, Duration ttl) {
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        cache.policy().expireVariably()
                .ifPresentOrElse(
                        expiration -> expiration.put(key, granted, effectiveTtl),
                        () -> cache.put(key, granted)
                );
    }

    @Override
    public void deletePattern(String pattern) {
        cache.asMap().keySet().removeIf(key -> PatternMatchUtils.simpleMatch(pattern, key));
    }

    /**
     * Expires entries a fixed time after each write. Reads do not extend the lifetime.
     */
    private static final class WriteExpiry implements Expiry<String, Boolean> {

        private final long ttlNanos;

        private WriteExpiry(Duration ttl) {
            this.ttlNanos = ttl.toNanos();
        }

        @Override
        public long expireAfterCreate(String key, Boolean value, long currentTime) {
            return ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Boolean value, long currentTime, long currentDuration) {
            return ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, Boolean value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
