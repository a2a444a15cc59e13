package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.LedgerTestSupport;
import com.flagship.general_ledger.ledger.ConsistencyWarning;
import com.flagship.general_ledger.posting.PostedEntry;
import com.flagship.general_ledger.posting.PostingEngine;
import com.flagship.general_ledger.projection.AccountBalanceStore;
import com.flagship.general_ledger.projection.BalanceProjector;
import com.flagship.general_ledger.projection.BalanceQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doAnswer;

class LedgerReconciliationServiceTest extends LedgerTestSupport {

    @Autowired
    private LedgerReconciliationService reconciliationService;

    @Autowired
    private PostingEngine postingEngine;

    @Autowired
    private BalanceQueryService balanceQueryService;

    @Autowired
    private BalanceRepairQueue repairQueue;

    @Autowired
    private AccountBalanceStore balanceStore;

    @SpyBean
    private BalanceProjector balanceProjector;

    @Test
    @DisplayName("A consistent ledger reconciles clean")
    void cleanLedger() {
        postingEngine.post(saleInvoice("42"));
        postingEngine.post(salePayment("42"));

        ReconciliationReport report = reconciliationService.reconcile();

        assertTrue(report.isClean());
        assertEquals(15, report.getAccountsRematerialized());
        assertEquals(0, report.getMirrorsRefreshed());
        assertFalse(report.getFinishedAt().isBefore(report.getStartedAt()));
    }

    @Test
    @DisplayName("Drifted balances and mirrors are reported, rebuilt, and clean on the next run")
    void repairsDrift() {
        // Given
        postingEngine.post(saleInvoice("42"));
        postingEngine.post(salePayment("42"));
        jdbcTemplate.update("UPDATE account_balances SET balance = 1 WHERE account_id = ?", accountId(CASH));
        jdbcTemplate.update("UPDATE cash_banks SET balance = 5 WHERE code = ?", CASH_REGISTER);
        repairQueue.enqueue(accountId(CASH), "manual");

        // When
        ReconciliationReport report = reconciliationService.reconcile();

        // Then: each kind of drift is reported once
        assertFalse(report.isClean());
        assertEquals(List.of(CASH), codes(report, ConsistencyWarning.Kind.LEAF_DRIFT));
        assertEquals(List.of(CURRENT_ASSETS), codes(report, ConsistencyWarning.Kind.HEADER_ROLLUP));
        assertEquals(List.of(CASH), codes(report, ConsistencyWarning.Kind.MIRROR_DRIFT));
        assertTrue(report.warningsOfKind(ConsistencyWarning.Kind.ENTRY_TOTALS).isEmpty());
        assertEquals(1, report.getMirrorsRefreshed());
        assertEquals(1, report.getRepairsCleared());

        // And: everything derived is back in line with the journal
        assertAmount("2220000.00", balanceQueryService.balanceOf(CASH));
        assertAmount("2220000.00", balanceQueryService.balanceOf(CURRENT_ASSETS));
        assertAmount("2220000.00", cashBankRegisterService.findByCode(CASH_REGISTER).orElseThrow().getBalance());
        assertEquals(0, repairQueue.size());
        assertTrue(reconciliationService.reconcile().isClean());
    }

    @Test
    @DisplayName("Entry total mismatches are reported but never rewritten")
    void entryTotalsAreOnlyReported() {
        PostedEntry posted = postingEngine.post(saleInvoice("42"));
        jdbcTemplate.update("UPDATE journal_entries SET total_debit = 1, total_credit = 1 WHERE id = ?", posted.getId());

        ReconciliationReport first = reconciliationService.reconcile();
        ReconciliationReport second = reconciliationService.reconcile();

        assertEquals(List.of(posted.getEntryNumber()), codes(first, ConsistencyWarning.Kind.ENTRY_TOTALS));
        assertEquals(List.of(posted.getEntryNumber()), codes(second, ConsistencyWarning.Kind.ENTRY_TOTALS));
    }

    @Test
    @DisplayName("An empty queue and consistent mirrors need no work")
    void nothingToDo() {
        postingEngine.post(salePayment("42"));

        assertEquals(0, reconciliationService.drainRepairQueue());
        assertTrue(reconciliationService.sweepMirrors().isEmpty());
    }

    @Test
    @DisplayName("An account queued while the rebuild runs stays queued until it is repaired")
    void postingDuringRebuildKeepsItsRepair() {
        // Given: one request queued before the run, and projection failing for postings while it runs
        repairQueue.enqueue(accountId(BANK), "manual");
        AtomicBoolean projectionDown = new AtomicBoolean(false);
        doAnswer(invocation -> {
            if (projectionDown.get()) {
                throw new IllegalStateException("projection store unavailable");
            }
            return invocation.callRealMethod();
        }).when(balanceProjector).projectAffected(anyCollection());
        doAnswer(invocation -> {
            Object rebuilt = invocation.callRealMethod();
            // the rebuild has read the journal; this posting lands after it
            projectionDown.set(true);
            try {
                postingEngine.post(saleInvoice("77"));
            } finally {
                projectionDown.set(false);
            }
            return rebuilt;
        }).when(balanceProjector).rematerializeAll();

        // When
        ReconciliationReport report = reconciliationService.reconcile();

        // Then: the earlier request is cleared, the later ones are not
        assertEquals(1, report.getRepairsCleared());
        assertFalse(repairQueue.contains(accountId(BANK)));
        assertTrue(repairQueue.contains(accountId(RECEIVABLE)));
        assertTrue(repairQueue.contains(accountId(SALES_REVENUE)));
        assertTrue(repairQueue.contains(accountId(TAX_PAYABLE)));
        assertAmount("0.00", balanceStore.find(accountId(RECEIVABLE)).orElseThrow().getBalance());

        // When: the scheduled drain runs
        assertEquals(3, reconciliationService.drainRepairQueue());

        // Then
        assertEquals(0, repairQueue.size());
        assertAmount("2220000.00", balanceQueryService.balanceOf(RECEIVABLE));
        assertAmount("2220000.00", balanceQueryService.balanceOf(ASSETS));
    }

    @Test
    @DisplayName("An account queued again while its repair runs stays queued")
    void requeueDuringDrainIsKept() {
        // Given
        postingEngine.post(saleInvoice("42"));
        repairQueue.enqueue(accountId(RECEIVABLE), "manual");
        doAnswer(invocation -> {
            Object projected = invocation.callRealMethod();
            repairQueue.enqueue(accountId(RECEIVABLE), "posting projection failed");
            return projected;
        }).when(balanceProjector).projectAccount(any());

        // When
        int repaired = reconciliationService.drainRepairQueue();

        // Then
        assertEquals(1, repaired);
        assertTrue(repairQueue.contains(accountId(RECEIVABLE)));
        BalanceRepairQueue.Item item = repairQueue.nextBatch(10).get(0);
        assertEquals(1, item.getGeneration());
        assertEquals("posting projection failed", item.getReason());
    }

    private static List<String> codes(ReconciliationReport report, ConsistencyWarning.Kind kind) {
        return report.warningsOfKind(kind).stream().map(ConsistencyWarning::getSubjectCode).toList();
    }
}
