package com.parkezy.booking.reconciliation;

import java.time.Instant;
import java.util.List;

public record ReconciliationReport(Instant checkedAt, List<Inconsistency> inconsistencies) {

    public ReconciliationReport {
        inconsistencies = List.copyOf(inconsistencies);
    }

    public boolean isConsistent() {
        return inconsistencies.isEmpty();
    }
}
