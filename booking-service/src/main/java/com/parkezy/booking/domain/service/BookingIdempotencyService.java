package com.parkezy.booking.domain.service;

import com.parkezy.booking.domain.model.BookingIdempotency;
import com.parkezy.booking.domain.repository.BookingIdempotencyRepository;
import com.parkezy.common.exception.ServiceUnavailableException;
import com.parkezy.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Creation idempotency keys, scoped per driver.
 *
 * The database row is the source of truth and is written in the same transaction as the
 * booking, so a key can never point at a booking that was rolled back. Redis is a
 * read-through cache in front of it, warmed only from committed rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingIdempotencyService {

    private static final String UNAVAILABLE_MSG =
            "Idempotency check temporarily unavailable. Retry with same key later.";
    private static final Duration CACHE_TTL = Duration.ofHours(24);

    private final BookingIdempotencyRepository idempotencyRepository;
    private final Clock clock;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${parking.idempotency.redis-cache:true}")
    private boolean redisCacheEnabled;

    /**
     * Booking previously created under this key, if any. Redis first, then the database.
     *
     * @throws ServiceUnavailableException if the database cannot be consulted
     */
    @Transactional(readOnly = true)
    public Optional<Long> findBookingId(String driverId, String key) {
        String scopedKey = scope(driverId, key);
        Optional<Long> cached = readCache(scopedKey);
        if (cached.isPresent()) {
            return cached;
        }
        try {
            Optional<Long> stored = idempotencyRepository.findById(scopedKey).map(BookingIdempotency::getBookingId);
            stored.ifPresent(bookingId -> warmCache(scopedKey, bookingId));
            return stored;
        } catch (DataAccessException e) {
            log.warn("Idempotency store (DB) unavailable for key: {}", scopedKey, e);
            throw new ServiceUnavailableException(UNAVAILABLE_MSG, e);
        }
    }

    /**
     * Records the key in the caller's transaction. A concurrent duplicate surfaces as a
     * {@link org.springframework.dao.DataIntegrityViolationException} and rolls the caller back.
     */
    @Transactional
    public void record(String driverId, String key, Long bookingId) {
        idempotencyRepository.saveAndFlush(new BookingIdempotency(scope(driverId, key), bookingId, clock.instant()));
    }

    public static boolean hasKey(String key) {
        return key != null && !key.isBlank();
    }

    static String scope(String driverId, String key) {
        return driverId + ":" + key;
    }

    private Optional<Long> readCache(String scopedKey) {
        if (!redisCacheEnabled || stringRedisTemplate == null) {
            return Optional.empty();
        }
        try {
            String value = stringRedisTemplate.opsForValue().get(Constants.IDEMPOTENCY_CACHE_PREFIX + scopedKey);
            if (value != null) {
                log.debug("Idempotency hit from Redis for key: {}", scopedKey);
                return Optional.of(Long.valueOf(value));
            }
        } catch (RuntimeException e) {
            log.debug("Redis idempotency read missed or failed, falling back to DB: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private void warmCache(String scopedKey, Long bookingId) {
        if (!redisCacheEnabled || stringRedisTemplate == null) {
            return;
        }
        try {
            stringRedisTemplate.opsForValue().set(
                    Constants.IDEMPOTENCY_CACHE_PREFIX + scopedKey, String.valueOf(bookingId), CACHE_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to warm Redis idempotency cache for key: {} (non-fatal)", scopedKey, e);
        }
    }
}
