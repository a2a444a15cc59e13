package com.flagship.general_ledger.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background repair of derived balances. Fixed delays, so a slow run is
 * never overlapped by the next one.
 */
@Component
@ConditionalOnProperty(name = "ledger.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReconciliationScheduler {

    private final LedgerReconciliationService reconciliationService;

    @Scheduled(fixedDelayString = "${ledger.reconciliation.repair-interval-ms:30000}")
    public void drainRepairQueue() {
        try {
            reconciliationService.drainRepairQueue();
        } catch (Exception e) {
            log.error("Error draining balance repair queue", e);
        }
    }

    @Scheduled(fixedDelayString = "${ledger.reconciliation.sweep-interval-ms:300000}",
               initialDelayString = "${ledger.reconciliation.sweep-interval-ms:300000}")
    public void sweepMirrors() {
        try {
            reconciliationService.sweepMirrors();
        } catch (Exception e) {
            log.error("Error in operational mirror sweep", e);
        }
    }
}
