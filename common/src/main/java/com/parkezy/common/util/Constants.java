package com.parkezy.common.util;

/**
 * Shared constants.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String FACILITY_LOCK_PREFIX = "lock:facility:";
    public static final String IDEMPOTENCY_CACHE_PREFIX = "idempotency:booking:";

    public static final int ACCESS_CODE_DIGITS = 6;
    public static final int MONEY_SCALE = 2;
}
