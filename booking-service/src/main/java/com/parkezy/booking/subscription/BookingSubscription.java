package com.parkezy.booking.subscription;

import com.parkezy.booking.domain.model.Booking;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Handle on a live feed. Receives full result-set snapshots, never diffs, and may receive
 * the same snapshot more than once. Closing the handle stops delivery.
 */
@Slf4j
public class BookingSubscription implements AutoCloseable {

    @Getter
    private final String id = UUID.randomUUID().toString();
    @Getter
    private final BookingFeed feed;
    private final Consumer<List<Booking>> sink;
    private final Consumer<BookingSubscription> onCancel;
    private final AtomicBoolean active = new AtomicBoolean(true);

    BookingSubscription(BookingFeed feed, Consumer<List<Booking>> sink, Consumer<BookingSubscription> onCancel) {
        this.feed = feed;
        this.sink = sink;
        this.onCancel = onCancel;
    }

    public boolean isActive() {
        return active.get();
    }

    public void cancel() {
        if (active.compareAndSet(true, false)) {
            onCancel.accept(this);
            log.debug("Subscription {} on {} cancelled", id, feed);
        }
    }

    @Override
    public void close() {
        cancel();
    }

    /** A sink that throws is treated as gone and the subscription is cancelled. */
    void deliver(List<Booking> snapshot) {
        if (!isActive()) {
            return;
        }
        try {
            sink.accept(snapshot);
        } catch (RuntimeException e) {
            log.warn("Subscriber {} on {} failed, cancelling: {}", id, feed, e.getMessage());
            cancel();
        }
    }
}
