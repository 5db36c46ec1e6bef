package com.parkezy.booking.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Maps a driver-scoped idempotency key to the booking its first request created.
 * Written in the same transaction as the booking itself.
 *
 * The key is assigned, so a freshly built row reports itself as new. Saving it is then always
 * an INSERT and a committed duplicate fails on the primary key instead of being overwritten.
 */
@Entity
@Table(name = "booking_idempotency")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingIdempotency implements Persistable<String> {

    @Id
    @Column(name = "idempotency_key", length = 300)
    private String idempotencyKey;

    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Transient
    private boolean isNew = true;

    public BookingIdempotency(String idempotencyKey, Long bookingId, Instant createdAt) {
        this.idempotencyKey = idempotencyKey;
        this.bookingId = bookingId;
        this.createdAt = createdAt;
    }

    @Override
    public String getId() {
        return idempotencyKey;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }
}
