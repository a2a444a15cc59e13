package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.account.AccountDirectory;
import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.ledger.ConsistencyWarning;
import com.flagship.general_ledger.ledger.LedgerIntegrityChecker;
import com.flagship.general_ledger.mirror.OperationalMirrorAdapter;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.projection.AccountBalance;
import com.flagship.general_ledger.projection.AccountBalanceStore;
import com.flagship.general_ledger.projection.BalanceProjector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Brings derived balances back in line with the journal.
 *
 * Three entry points:
 * - {@link #reconcile()}: detect every kind of drift, then rebuild all balances and refresh mismatched mirrors
 * - {@link #drainRepairQueue()}: repair accounts whose refresh failed after a posting
 * - {@link #sweepMirrors()}: validate every mirror and refresh the ones that differ
 *
 * All three only recompute from the journal, so running them repeatedly or
 * while postings continue is safe. The loops check for interruption between
 * accounts and stop there.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerReconciliationService {

    private final AccountDirectory accountDirectory;
    private final BalanceProjector balanceProjector;
    private final AccountBalanceStore balanceStore;
    private final OperationalMirrorAdapter mirrorAdapter;
    private final LedgerIntegrityChecker integrityChecker;
    private final BalanceRepairQueue repairQueue;
    private final LedgerMetrics ledgerMetrics;
    private final LedgerProperties ledgerProperties;

    public ReconciliationReport reconcile() {
        boolean owner = CorrelationContext.open();
        Instant startedAt = Instant.now();
        try {
            log.info("Starting ledger reconciliation");

            List<ConsistencyWarning> warnings = new ArrayList<>(integrityChecker.check());
            warnings.addAll(balanceProjector.verifyLeaves());
            warnings.addAll(balanceProjector.verifyRollups());
            warnings.addAll(detectMirrorDrift());

            // Read before the rebuild: only requests the rebuild has seen may be cleared by it.
            List<BalanceRepairQueue.Item> queuedBeforeRebuild = repairQueue.nextBatch(Integer.MAX_VALUE);
            Map<UUID, AccountBalance> rebuilt = balanceProjector.rematerializeAll();

            int refreshed = 0;
            int failures = 0;
            for (UUID accountId : mirrorAdapter.mirroredAccountIds()) {
                if (Thread.currentThread().isInterrupted()) {
                    log.info("Reconciliation interrupted during mirror refresh");
                    break;
                }
                if (mirrorAdapter.validate(accountId)) {
                    continue;
                }
                try {
                    mirrorAdapter.refresh(accountId);
                    refreshed++;
                } catch (RuntimeException e) {
                    failures++;
                    ledgerMetrics.recordMirrorFailure();
                    log.error("Mirror refresh failed during reconciliation: account={}, error={}",
                            accountId, e.getMessage());
                    repairQueue.enqueue(accountId, "reconciliation mirror refresh: " + e.getMessage());
                }
            }

            int cleared = clearRepairedAccounts(queuedBeforeRebuild);

            ReconciliationReport report = new ReconciliationReport(
                startedAt, Instant.now(), List.copyOf(warnings), rebuilt.size(), refreshed, failures, cleared);
            log.info("Ledger reconciliation finished: warnings={}, rematerialized={}, mirrorsRefreshed={}, "
                    + "mirrorFailures={}, repairsCleared={}",
                    warnings.size(), rebuilt.size(), refreshed, failures, cleared);
            return report;
        } finally {
            CorrelationContext.close(owner);
        }
    }

    /**
     * Repairs up to one batch of queued accounts: reproject the account and
     * its ancestors, then refresh its mirror. Failed items stay queued with
     * their attempt count raised.
     *
     * @return number of accounts repaired
     */
    public int drainRepairQueue() {
        boolean owner = CorrelationContext.open();
        try {
            List<BalanceRepairQueue.Item> batch =
                repairQueue.nextBatch(ledgerProperties.getReconciliation().getRepairBatchSize());
            if (batch.isEmpty()) {
                return 0;
            }
            log.info("Draining balance repair queue: batch={}", batch.size());

            int repaired = 0;
            for (BalanceRepairQueue.Item item : batch) {
                if (Thread.currentThread().isInterrupted()) {
                    log.info("Repair queue drain interrupted after {} account(s)", repaired);
                    break;
                }
                try {
                    balanceProjector.projectAccount(item.getAccountId());
                    balanceProjector.projectAncestors(item.getAccountId());
                    if (mirrorAdapter.hasMirror(item.getAccountId())) {
                        mirrorAdapter.refresh(item.getAccountId());
                    }
                    if (!repairQueue.removeIfUnchanged(item)) {
                        log.debug("Account {} was queued again during its repair; kept for the next pass",
                                item.getAccountId());
                    }
                    ledgerMetrics.recordRepair("repaired");
                    repaired++;
                } catch (RuntimeException e) {
                    ledgerMetrics.recordRepair("failed");
                    log.warn("Balance repair failed: account={}, attempt={}, error={}",
                            item.getAccountId(), item.getAttempts() + 1, e.getMessage());
                    repairQueue.recordFailedAttempt(item.getAccountId(), e.getMessage());
                }
            }
            return repaired;
        } finally {
            CorrelationContext.close(owner);
        }
    }

    /**
     * Validates every mirror against its projected balance and refreshes the
     * ones that differ. An account that was never projected is projected
     * first.
     *
     * @return drift found, one warning per refreshed mirror
     */
    public List<ConsistencyWarning> sweepMirrors() {
        boolean owner = CorrelationContext.open();
        try {
            List<ConsistencyWarning> drift = new ArrayList<>();
            for (UUID accountId : mirrorAdapter.mirroredAccountIds()) {
                if (Thread.currentThread().isInterrupted()) {
                    log.info("Mirror sweep interrupted");
                    break;
                }
                if (mirrorAdapter.validate(accountId)) {
                    continue;
                }
                drift.add(mirrorDriftWarning(accountId));
                try {
                    if (balanceStore.find(accountId).isEmpty()) {
                        balanceProjector.projectAffected(List.of(accountId));
                    }
                    mirrorAdapter.refresh(accountId);
                } catch (RuntimeException e) {
                    ledgerMetrics.recordMirrorFailure();
                    log.error("Mirror sweep could not refresh account {}: {}", accountId, e.getMessage());
                    repairQueue.enqueue(accountId, "mirror sweep: " + e.getMessage());
                }
            }
            if (!drift.isEmpty()) {
                log.info("Mirror sweep refreshed {} drifted mirror(s)", drift.size());
            }
            return drift;
        } finally {
            CorrelationContext.close(owner);
        }
    }

    private List<ConsistencyWarning> detectMirrorDrift() {
        List<ConsistencyWarning> drift = new ArrayList<>();
        for (UUID accountId : mirrorAdapter.mirroredAccountIds()) {
            if (!mirrorAdapter.validate(accountId)) {
                drift.add(mirrorDriftWarning(accountId));
            }
        }
        return drift;
    }

    private ConsistencyWarning mirrorDriftWarning(UUID accountId) {
        Optional<AccountBalance> projected = balanceStore.find(accountId);
        BigDecimal expected = projected.map(AccountBalance::getBalance).orElse(null);
        BigDecimal actual = mirrorAdapter.mirroredBalance(accountId).orElse(null);
        String accountCode = accountDirectory.getById(accountId).getCode();
        ConsistencyWarning warning = new ConsistencyWarning(
            ConsistencyWarning.Kind.MIRROR_DRIFT, accountId, accountCode, expected, actual,
            projected.isPresent() ? "mirror differs from projected balance" : "account has no projected balance");
        ledgerMetrics.recordConsistencyWarning(warning.getKind());
        log.warn("Consistency warning: kind={}, account={}, expected={}, actual={}, {}",
                warning.getKind(), accountCode, expected, actual, warning.getDetail());
        return warning;
    }

    // An account queued again after the snapshot keeps its row: the rebuild may have read its lines too early.
    private int clearRepairedAccounts(List<BalanceRepairQueue.Item> queuedBeforeRebuild) {
        int cleared = 0;
        for (BalanceRepairQueue.Item item : queuedBeforeRebuild) {
            if (mirrorAdapter.validate(item.getAccountId()) && repairQueue.removeIfUnchanged(item)) {
                cleared++;
            }
        }
        return cleared;
    }
}
