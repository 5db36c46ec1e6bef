package com.parkezy.booking.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled sweep for capacity and slot drift left by partial failures.
 * Reports only unless {@code parking.reconciliation.repair} is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationJob {

    private final ReconciliationService reconciliationService;

    @Value("${parking.reconciliation.enabled:true}")
    private boolean enabled;

    @Value("${parking.reconciliation.repair:false}")
    private boolean repair;

    @Scheduled(fixedDelayString = "${parking.reconciliation.interval-ms:300000}",
            initialDelayString = "${parking.reconciliation.initial-delay-ms:60000}")
    public void run() {
        if (!enabled) return;
        try {
            ReconciliationReport report = reconciliationService.reconcile(repair);
            if (report.isConsistent()) {
                log.debug("Reconciliation found no drift");
            } else {
                log.warn("Reconciliation found {} inconsistency(ies), repair={}", report.inconsistencies().size(), repair);
            }
        } catch (Exception e) {
            log.error("Reconciliation run failed", e);
        }
    }
}
