package com.parkezy.booking.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum BookingType {
    /** Driveway listing, host approval unless auto-accept, tracked per slot. */
    PRIVATE("private"),
    /** Facility parking, instant confirmation, tracked by aggregate capacity. */
    COMMERCIAL("commercial");

    private final String wireValue;

    BookingType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static BookingType fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown booking type: " + value));
    }
}
