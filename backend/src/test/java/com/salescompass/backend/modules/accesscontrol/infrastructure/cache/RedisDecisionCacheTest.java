package com.salescompass.backend.modules.accesscontrol.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisDecisionCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private Cursor<String> cursor;

    private RedisDecisionCache cache;

    @BeforeEach
    void setUp() {
        cache = new RedisDecisionCache(redisTemplate, "crm:");
    }

    @Test
    void readsAndWritesPrefixedKeys() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("crm:access_u_leads_access")).thenReturn("1");
        when(valueOperations.get("crm:access_u_reports_access")).thenReturn("0");

        cache.put("access_u_leads_access", true, Duration.ofSeconds(300));

        verify(valueOperations).set("crm:access_u_leads_access", "1", Duration.ofSeconds(300));
        assertThat(cache.get("access_u_leads_access")).contains(true);
        assertThat(cache.get("access_u_reports_access")).contains(false);
    }

    @Test
    void unavailableRedisIsAMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(any())).thenThrow(new RedisConnectionFailureException("connection refused"));
        doThrow(new RedisConnectionFailureException("connection refused"))
                .when(valueOperations).set(any(), any(), any(Duration.class));

        assertThat(cache.get("access_u_leads_access")).isEmpty();
        assertThatCode(() -> cache.put("access_u_leads_access", true, Duration.ofSeconds(1))).doesNotThrowAnyException();
    }

    @Test
    @SuppressWarnings("unchecked")
    void deletePatternScansAndDeletesMatches() {
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);
        doAnswer(inv -> {
            Consumer<String> sink = inv.getArgument(0);
            sink.accept("crm:access_u_leads_access");
            sink.accept("crm:access_u_reports_view");
            return null;
        }).when(cursor).forEachRemaining(any());

        cache.deletePattern("access_u_*");

        ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
        verify(redisTemplate).scan(options.capture());
        assertThat(options.getValue().getPattern()).isEqualTo("crm:access_u_*");
        ArgumentCaptor<List<String>> deleted = ArgumentCaptor.forClass(List.class);
        verify(redisTemplate).delete(deleted.capture());
        assertThat(deleted.getValue()).containsExactly("crm:access_u_leads_access", "crm:access_u_reports_view");
        verify(cursor).close();
    }

    @Test
    void deletePatternWithoutMatchesDeletesNothing() {
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);

        cache.deletePattern("access_u_*");

        verify(redisTemplate, never()).delete(anyCollection());
    }
}
