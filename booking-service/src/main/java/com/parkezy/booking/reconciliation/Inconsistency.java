package com.parkezy.booking.reconciliation;

/**
 * One partial-failure finding.
 *
 * @param resource e.g. "facility:12" or "slot:7/3"
 * @param repaired whether this run fixed it
 */
public record Inconsistency(InconsistencyKind kind, String resource, String detail, boolean repaired) {
}
