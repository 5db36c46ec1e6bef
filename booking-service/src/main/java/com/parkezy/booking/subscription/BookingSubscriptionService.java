package com.parkezy.booking.subscription;

import com.parkezy.booking.domain.model.Booking;
import com.parkezy.booking.ledger.BookingChangedEvent;
import com.parkezy.booking.ledger.BookingLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Server-side push of booking result sets.
 *
 * A new subscription gets the current snapshot right away. After every committed change
 * that touches its owner the feed is re-queried and the whole snapshot pushed again.
 * Deliveries run on the subscription executor; query and push for one subscription are
 * serialized, so a subscriber never sees an older snapshot after a newer one.
 */
@Slf4j
@Service
public class BookingSubscriptionService {

    private final BookingLedger ledger;
    private final Executor executor;
    private final Map<String, BookingSubscription> subscriptions = new ConcurrentHashMap<>();

    public BookingSubscriptionService(BookingLedger ledger,
                                      @Qualifier("subscriptionExecutor") Executor executor) {
        this.ledger = ledger;
        this.executor = executor;
    }

    public BookingSubscription subscribe(BookingFeed feed, Consumer<List<Booking>> sink) {
        BookingSubscription subscription = new BookingSubscription(feed, sink,
                cancelled -> subscriptions.remove(cancelled.getId()));
        subscriptions.put(subscription.getId(), subscription);
        log.debug("Subscription {} opened on {}", subscription.getId(), feed);
        executor.execute(() -> refresh(subscription));
        return subscription;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBookingChanged(BookingChangedEvent event) {
        subscriptions.values().stream()
                .filter(subscription -> subscription.getFeed().isAffectedBy(event))
                .forEach(subscription -> executor.execute(() -> refresh(subscription)));
    }

    public int activeSubscriptionCount() {
        return subscriptions.size();
    }

    void refresh(BookingSubscription subscription) {
        synchronized (subscription) {
            if (!subscription.isActive()) {
                return;
            }
            List<Booking> snapshot;
            try {
                snapshot = query(subscription.getFeed());
            } catch (RuntimeException e) {
                // Next committed change re-queries; the subscriber keeps its last snapshot.
                log.warn("Failed to query {} for subscription {}", subscription.getFeed(), subscription.getId(), e);
                return;
            }
            subscription.deliver(snapshot);
        }
    }

    private List<Booking> query(BookingFeed feed) {
        return switch (feed.type()) {
            case DRIVER_BOOKINGS -> ledger.findByDriver(feed.ownerId());
            case DRIVER_ACTIVE_BOOKINGS -> ledger.findActiveByDriver(feed.ownerId());
            case HOST_BOOKINGS -> ledger.findByHost(feed.ownerId());
            case HOST_PENDING_APPROVALS -> ledger.findPendingApprovals(feed.ownerId());
        };
    }
}
