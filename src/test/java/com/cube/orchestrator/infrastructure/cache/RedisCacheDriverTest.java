package com.cube.orchestrator.infrastructure.cache;

import com.cube.orchestrator.domain.model.CachedQueryResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisCacheDriver. The circuit breaker is not active without
 * the Spring context, so only serialization and key handling are covered here.
 */
@ExtendWith(MockitoExtension.class)
class RedisCacheDriverTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private ObjectMapper objectMapper;
    private RedisCacheDriver driver;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        driver = new RedisCacheDriver(redisTemplate, objectMapper);
    }

    @Test
    void testSet_WritesJsonWithTtl() throws Exception {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        CachedQueryResult entry = new CachedQueryResult(List.of(Map.of("cnt", 3)), "v1",
                Instant.parse("2024-03-01T10:00:00Z"));

        // When
        driver.set("SQL_QUERY_RESULT:a:fp", entry, Duration.ofHours(24));

        // Then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("SQL_QUERY_RESULT:a:fp"), json.capture(), eq(Duration.ofHours(24)));
        CachedQueryResult stored = objectMapper.readValue(json.getValue(), CachedQueryResult.class);
        assertEquals("v1", stored.getFreshnessToken());
        assertEquals(List.of(Map.of("cnt", 3)), stored.getValue());
    }

    @Test
    void testSet_KeepsSubSecondTtl() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        // When
        driver.set("k", Map.of("cnt", 1), Duration.ofMillis(500));

        // Then
        verify(valueOperations).set(eq("k"), anyString(), eq(Duration.ofMillis(500)));
    }

    @Test
    void testSet_SkipsExpiredEntry() {
        // When
        driver.set("k", Map.of("cnt", 1), Duration.ZERO);

        // Then
        verifyNoInteractions(valueOperations);
    }

    @Test
    void testGet_ReadsJson() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("k")).thenReturn(
                "{\"value\":[{\"cnt\":3}],\"freshnessToken\":\"v1\",\"createdAt\":\"2024-03-01T10:00:00Z\"}");

        // When
        Optional<CachedQueryResult> result = driver.get("k", CachedQueryResult.class);

        // Then
        assertTrue(result.isPresent());
        assertEquals("v1", result.get().getFreshnessToken());
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), result.get().getCreatedAt());
    }

    @Test
    void testGet_MissingOrCorruptIsMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("missing")).thenReturn(null);
        when(valueOperations.get("corrupt")).thenReturn("{not json");

        assertTrue(driver.get("missing", CachedQueryResult.class).isEmpty());
        assertTrue(driver.get("corrupt", CachedQueryResult.class).isEmpty());
    }

    @Test
    void testInvalidate_DeletesKey() {
        driver.invalidate("k");

        verify(redisTemplate).delete("k");
    }
}
