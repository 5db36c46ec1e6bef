package com.parkezy.booking.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Booking lifecycle status.
 *
 * <pre>
 * requested -> confirmed -> active -> completed
 * requested -> rejected
 * confirmed -> cancelled | cancel_requested | no_show
 * active    -> cancelled | cancel_requested
 * cancel_requested -> cancelled
 * </pre>
 *
 * Private cancellations go straight to {@code cancelled}; commercial ones pass through
 * {@code cancel_requested} until the owner confirms.
 */
public enum BookingStatus {
    REQUESTED("requested"),
    CONFIRMED("confirmed"),
    ACTIVE("active"),
    CANCEL_REQUESTED("cancel_requested"),
    CANCELLED("cancelled"),
    COMPLETED("completed"),
    REJECTED("rejected"),
    NO_SHOW("no_show");

    /** Statuses in which a booking holds its slot or a facility capacity unit. */
    public static final Set<BookingStatus> HOLDING = Collections.unmodifiableSet(
            EnumSet.of(CONFIRMED, ACTIVE, CANCEL_REQUESTED));

    private static final Map<BookingStatus, Set<BookingStatus>> TRANSITIONS = new EnumMap<>(BookingStatus.class);

    static {
        TRANSITIONS.put(REQUESTED, EnumSet.of(CONFIRMED, REJECTED));
        TRANSITIONS.put(CONFIRMED, EnumSet.of(ACTIVE, CANCELLED, CANCEL_REQUESTED, NO_SHOW));
        TRANSITIONS.put(ACTIVE, EnumSet.of(COMPLETED, CANCELLED, CANCEL_REQUESTED));
        TRANSITIONS.put(CANCEL_REQUESTED, EnumSet.of(CANCELLED));
        for (BookingStatus terminal : EnumSet.of(CANCELLED, COMPLETED, REJECTED, NO_SHOW)) {
            TRANSITIONS.put(terminal, EnumSet.noneOf(BookingStatus.class));
        }
    }

    private final String wireValue;

    BookingStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public boolean canTransitionTo(BookingStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean holdsResource() {
        return HOLDING.contains(this);
    }

    @JsonCreator
    public static BookingStatus fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown booking status: " + value));
    }
}
