package com.parkezy.booking.domain.model;

public enum FacilityType {
    MALL,
    AIRPORT,
    HOSPITAL,
    OFFICE,
    APARTMENT,
    STADIUM
}
