package com.parkezy.booking.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class BookingTypeConverter implements AttributeConverter<BookingType, String> {

    @Override
    public String convertToDatabaseColumn(BookingType type) {
        return type == null ? null : type.getWireValue();
    }

    @Override
    public BookingType convertToEntityAttribute(String value) {
        return value == null ? null : BookingType.fromWireValue(value);
    }
}
