package com.parkezy.booking.domain.service;

import com.parkezy.booking.domain.model.BookingIdempotency;
import com.parkezy.booking.domain.repository.BookingIdempotencyRepository;
import com.parkezy.common.exception.ServiceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingIdempotencyServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String CACHE_KEY = "idempotency:booking:driver-1:key-1";

    @Mock
    private BookingIdempotencyRepository idempotencyRepository;
    @Mock
    private StringRedisTemplate stringRedisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private BookingIdempotencyService service;

    @BeforeEach
    void setUp() {
        service = new BookingIdempotencyService(idempotencyRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(service, "stringRedisTemplate", stringRedisTemplate);
        ReflectionTestUtils.setField(service, "redisCacheEnabled", true);
    }

    @Test
    @DisplayName("Redis hit short-circuits the database")
    void findBookingId_cacheHit() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(CACHE_KEY)).thenReturn("11");

        assertThat(service.findBookingId("driver-1", "key-1")).contains(11L);
        verify(idempotencyRepository, never()).findById(anyString());
    }

    @Test
    @DisplayName("database hit warms the cache for 24 hours")
    void findBookingId_dbHitWarmsCache() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(CACHE_KEY)).thenReturn(null);
        when(idempotencyRepository.findById("driver-1:key-1"))
                .thenReturn(Optional.of(new BookingIdempotency("driver-1:key-1", 11L, NOW)));

        assertThat(service.findBookingId("driver-1", "key-1")).contains(11L);
        verify(valueOperations).set(CACHE_KEY, "11", Duration.ofHours(24));
    }

    @Test
    @DisplayName("a miss is not cached")
    void findBookingId_miss() {
        when(stringRedisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(CACHE_KEY)).thenReturn(null);
        when(idempotencyRepository.findById("driver-1:key-1")).thenReturn(Optional.empty());

        assertThat(service.findBookingId("driver-1", "key-1")).isEmpty();
        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("Redis failure falls back to the database")
    void findBookingId_redisDown() {
        when(stringRedisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("down"));
        when(idempotencyRepository.findById("driver-1:key-1")).thenReturn(Optional.empty());

        assertThat(service.findBookingId("driver-1", "key-1")).isEmpty();
    }

    @Test
    @DisplayName("database failure surfaces as ServiceUnavailable so the client retries with the same key")
    void findBookingId_dbDown() {
        ReflectionTestUtils.setField(service, "redisCacheEnabled", false);
        when(idempotencyRepository.findById("driver-1:key-1"))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> service.findBookingId("driver-1", "key-1"))
                .isInstanceOf(ServiceUnavailableException.class);
    }

    @Test
    @DisplayName("keys are scoped per driver")
    void record_scopesKeyByDriver() {
        service.record("driver-2", "key-1", 12L);

        ArgumentCaptor<BookingIdempotency> saved = ArgumentCaptor.forClass(BookingIdempotency.class);
        verify(idempotencyRepository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getIdempotencyKey()).isEqualTo("driver-2:key-1");
        assertThat(saved.getValue().getBookingId()).isEqualTo(12L);
        assertThat(saved.getValue().getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("blank keys are treated as absent")
    void hasKey() {
        assertThat(BookingIdempotencyService.hasKey(null)).isFalse();
        assertThat(BookingIdempotencyService.hasKey("  ")).isFalse();
        assertThat(BookingIdempotencyService.hasKey("k")).isTrue();
    }
}
