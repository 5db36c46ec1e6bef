package com.parkezy.booking.domain.model;

public enum UserCapability {
    CAN_DRIVE,
    CAN_HOST_PRIVATE,
    CAN_HOST_COMMERCIAL
}
