package com.parkezy.booking.domain.repository;

import com.parkezy.booking.domain.model.BookingIdempotency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Idempotency keys against a real PostgreSQL. No test-managed transaction, so every
 * saveAndFlush commits on its own like two separate requests would.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class BookingIdempotencyRepositoryIntegrationTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("parkezy_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create");
        registry.add("spring.flyway.enabled", () -> "false");
    }

    @Autowired
    private BookingIdempotencyRepository idempotencyRepository;

    @Test
    @DisplayName("recording a key that is already committed fails on the primary key and keeps the first booking")
    void saveAndFlush_committedDuplicate_isRejected() {
        String key = "driver-1:" + UUID.randomUUID();
        idempotencyRepository.saveAndFlush(new BookingIdempotency(key, 1L, NOW));

        assertThatThrownBy(() -> idempotencyRepository.saveAndFlush(new BookingIdempotency(key, 2L, NOW)))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(idempotencyRepository.findById(key))
                .get()
                .extracting(BookingIdempotency::getBookingId)
                .isEqualTo(1L);
    }

    @Test
    @DisplayName("a row read back from the database is no longer new")
    void loadedRow_isNotNew() {
        String key = "driver-1:" + UUID.randomUUID();
        BookingIdempotency created = new BookingIdempotency(key, 1L, NOW);
        assertThat(created.isNew()).isTrue();

        idempotencyRepository.saveAndFlush(created);

        assertThat(idempotencyRepository.findById(key)).get()
                .satisfies(loaded -> assertThat(loaded.isNew()).isFalse());
    }
}
