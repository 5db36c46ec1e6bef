package com.parkezy.booking.subscription;

import com.parkezy.booking.ledger.BookingChangedEvent;

import java.util.Objects;

public record BookingFeed(FeedType type, String ownerId) {

    public BookingFeed {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(ownerId, "ownerId");
    }

    public static BookingFeed driverBookings(String driverId) {
        return new BookingFeed(FeedType.DRIVER_BOOKINGS, driverId);
    }

    public static BookingFeed driverActiveBookings(String driverId) {
        return new BookingFeed(FeedType.DRIVER_ACTIVE_BOOKINGS, driverId);
    }

    public static BookingFeed hostBookings(String hostId) {
        return new BookingFeed(FeedType.HOST_BOOKINGS, hostId);
    }

    public static BookingFeed pendingApprovals(String hostId) {
        return new BookingFeed(FeedType.HOST_PENDING_APPROVALS, hostId);
    }

    public boolean isAffectedBy(BookingChangedEvent event) {
        return type.isAffectedBy(event, ownerId);
    }
}
