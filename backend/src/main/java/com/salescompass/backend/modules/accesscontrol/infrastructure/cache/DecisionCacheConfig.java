package com.salescompass.backend.modules.accesscontrol.infrastructure.cache;

import java.time.Duration;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.salescompass.backend.modules.accesscontrol.application.DecisionCache;

/**
 * Selects the decision cache backend from {@code crm.access.cache.type} ({@code memory} or {@code redis}).
 */
@Configuration(proxyBeanMethods = false)
public class DecisionCacheConfig {

    private static final Logger log = LoggerFactory.getLogger(DecisionCacheConfig.class);

    @Bean
    public DecisionCache decisionCache(
            @Value("${crm.access.cache.type:memory}") String type,
            @Value("${crm.access.cache.ttl:PT5M}") Duration ttl,
            @Value("${crm.access.cache.max-size:10000}") long maxSize,
            @Value("${crm.access.cache.redis.key-prefix:crm:}") String keyPrefix,
            ObjectProvider<StringRedisTemplate> redisTemplate
    ) {
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        log.info("Initializing access decision cache: type={}, ttl={}", normalized, ttl);
        return switch (normalized) {
            case "memory" -> new CaffeineDecisionCache(ttl, maxSize);
            case "redis" -> new RedisDecisionCache(redisTemplate.getObject(), keyPrefix);
            default -> throw new IllegalStateException("Unsupported crm.access.cache.type: " + type);
        };
    }
}
