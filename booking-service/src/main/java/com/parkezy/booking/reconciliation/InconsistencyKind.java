package com.parkezy.booking.reconciliation;

public enum InconsistencyKind {
    /** Facility available count differs from total minus holding bookings. */
    CAPACITY_DRIFT,
    /** Slot held by a booking that does not exist, no longer holds, or points elsewhere. */
    ORPHANED_SLOT_CLAIM,
    /** Holding private booking whose slot is not claimed by it. */
    MISSING_SLOT_CLAIM,
    /** Listing active-booking flag disagrees with its slots. */
    STALE_LISTING_FLAG
}
