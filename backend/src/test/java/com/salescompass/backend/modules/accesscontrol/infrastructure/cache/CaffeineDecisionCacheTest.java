package com.salescompass.backend.modules.accesscontrol.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.salescompass.backend.modules.accesscontrol.application.DecisionCacheKeys;

class CaffeineDecisionCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineDecisionCache cache;

    @BeforeEach
    void setUp() {
        cache = new CaffeineDecisionCache(Duration.ofMinutes(5), 100, nanos::get);
    }

    @Test
    void storesBothOutcomes() {
        cache.put("access_u_leads.export_access", true, null);
        cache.put("access_u_leads.delete_access", false, null);

        assertThat(cache.get("access_u_leads.export_access")).contains(true);
        assertThat(cache.get("access_u_leads.delete_access")).contains(false);
        assertThat(cache.get("access_u_other_access")).isEmpty();
    }

    @Test
    void entriesExpireAfterTheirTtl() {
        cache.put("short", true, Duration.ofSeconds(10));
        cache.put("default", true, null);

        advance(Duration.ofSeconds(11));
        assertThat(cache.get("short")).isEmpty();
        assertThat(cache.get("default")).contains(true);

        advance(Duration.ofMinutes(5));
        assertThat(cache.get("default")).isEmpty();
    }

    @Test
    void readsDoNotExtendTheLifetimeButRewritesDo() {
        cache.put("read", true, null);
        cache.put("rewritten", true, null);

        advance(Duration.ofMinutes(4));
        assertThat(cache.get("read")).contains(true);
        cache.put("rewritten", false, null);

        advance(Duration.ofMinutes(2));
        assertThat(cache.get("read")).isEmpty();
        assertThat(cache.get("rewritten")).contains(false);
    }

    @Test
    void deletePatternRemovesOnlyTheUsersEntries() {
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        cache.put(DecisionCacheKeys.decision(alice, "leads.export", "access"), true, null);
        cache.put(DecisionCacheKeys.decision(alice, "reports", "view"), false, null);
        cache.put(DecisionCacheKeys.decision(bob, "leads.export", "access"), true, null);

        cache.deletePattern(DecisionCacheKeys.userPattern(alice));

        assertThat(cache.get(DecisionCacheKeys.decision(alice, "leads.export", "access"))).isEmpty();
        assertThat(cache.get(DecisionCacheKeys.decision(alice, "reports", "view"))).isEmpty();
        assertThat(cache.get(DecisionCacheKeys.decision(bob, "leads.export", "access"))).contains(true);
        assertThat(cache.estimatedSize()).isEqualTo(1);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }
}
