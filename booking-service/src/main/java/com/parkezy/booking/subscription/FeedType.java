package com.parkezy.booking.subscription;

import com.parkezy.booking.ledger.BookingChangedEvent;

/**
 * Live result sets a client can follow. Each is keyed by the driver or the host it belongs to.
 */
public enum FeedType {
    DRIVER_BOOKINGS(Owner.DRIVER),
    DRIVER_ACTIVE_BOOKINGS(Owner.DRIVER),
    HOST_BOOKINGS(Owner.HOST),
    HOST_PENDING_APPROVALS(Owner.HOST);

    private enum Owner { DRIVER, HOST }

    private final Owner owner;

    FeedType(Owner owner) {
        this.owner = owner;
    }

    /** True if the change may alter this feed's result set for the given owner. */
    public boolean isAffectedBy(BookingChangedEvent event, String ownerId) {
        String eventOwner = owner == Owner.DRIVER ? event.driverId() : event.hostId();
        return ownerId.equals(eventOwner);
    }
}
