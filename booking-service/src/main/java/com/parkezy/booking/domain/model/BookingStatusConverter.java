package com.parkezy.booking.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists {@link BookingStatus} as its wire value ("cancel_requested", "no_show", ...).
 */
@Converter
public class BookingStatusConverter implements AttributeConverter<BookingStatus, String> {

    @Override
    public String convertToDatabaseColumn(BookingStatus status) {
        return status == null ? null : status.getWireValue();
    }

    @Override
    public BookingStatus convertToEntityAttribute(String value) {
        return value == null ? null : BookingStatus.fromWireValue(value);
    }
}
