package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.LedgerTestSupport;
import com.flagship.general_ledger.ledger.ConsistencyWarning;
import com.flagship.general_ledger.ledger.EntryStatus;
import com.flagship.general_ledger.ledger.LedgerStore;
import com.flagship.general_ledger.ledger.SourceType;
import com.flagship.general_ledger.mirror.CashBankMirror;
import com.flagship.general_ledger.projection.BalanceProjector;
import com.flagship.general_ledger.projection.BalanceQueryService;
import com.flagship.general_ledger.reconciliation.BalanceRepairQueue;
import com.flagship.general_ledger.reconciliation.LedgerReconciliationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.reset;

/**
 * Failures after the commit point must never undo a posting: the entry
 * stands, and the stale balances are queued for repair.
 */
class PostingEngineFailureTest extends LedgerTestSupport {

    @Autowired
    private PostingEngine postingEngine;

    @SpyBean
    private BalanceProjector balanceProjector;

    @SpyBean
    private CashBankMirror cashBankMirror;

    @SpyBean
    private LedgerStore ledgerStore;

    @Autowired
    private BalanceRepairQueue repairQueue;

    @Autowired
    private BalanceQueryService balanceQueryService;

    @Autowired
    private LedgerReconciliationService reconciliationService;

    @Test
    @DisplayName("Projection failure keeps the entry and queues its accounts for repair")
    void projectionFailureQueuesRepair() {
        // Given: projection is down
        doThrow(new IllegalStateException("projection store unavailable"))
            .when(balanceProjector).projectAffected(anyCollection());

        // When
        PostedEntry posted = postingEngine.post(saleInvoice("42"));

        // Then: the entry is durable, balances are stale and queued
        assertFalse(posted.isBalancesCurrent());
        assertEquals(EntryStatus.POSTED, ledgerStore.getById(posted.getId()).getStatus());
        assertTrue(balanceQueryService.allBalances().isEmpty());
        assertTrue(repairQueue.contains(accountId(RECEIVABLE)));
        assertTrue(repairQueue.contains(accountId(SALES_REVENUE)));
        assertTrue(repairQueue.contains(accountId(TAX_PAYABLE)));
        assertEquals(3, repairQueue.size());

        // When: projection recovers and the queue is drained
        reset(balanceProjector);
        int repaired = reconciliationService.drainRepairQueue();

        // Then
        assertEquals(3, repaired);
        assertEquals(0, repairQueue.size());
        assertAmount("2220000.00", balanceQueryService.balanceOf(RECEIVABLE));
        assertAmount("2000000.00", balanceQueryService.balanceOf(SALES_REVENUE));
        assertAmount("220000.00", balanceQueryService.balanceOf(TAX_PAYABLE));
        assertAmount("2220000.00", balanceQueryService.balanceOf(ASSETS));
        assertAmount("2000000.00", balanceQueryService.balanceOf(REVENUE));
    }

    @Test
    @DisplayName("Mirror failure keeps the entry and the ledger balance; the sweep repairs the mirror")
    void mirrorFailureIsRepairedBySweep() {
        // Given: the cash register cannot be written
        doThrow(new IllegalStateException("register locked"))
            .when(cashBankMirror).write(any(), any());

        // When
        PostedEntry posted = postingEngine.post(
            twoLine(SourceType.CASH_BANK, "CB-9", "DEPOSIT", CASH, CAPITAL, "750.00"));

        // Then: ledger is right, mirror is stale
        assertFalse(posted.isBalancesCurrent());
        assertAmount("750.00", balanceQueryService.balanceOf(CASH));
        assertAmount("0.00", cashBankRegisterService.findByCode(CASH_REGISTER).orElseThrow().getBalance());
        assertTrue(repairQueue.contains(accountId(CASH)));

        // When: the register recovers and the sweep runs
        reset(cashBankMirror);
        List<ConsistencyWarning> drift = reconciliationService.sweepMirrors();

        // Then
        assertEquals(1, drift.size());
        assertEquals(ConsistencyWarning.Kind.MIRROR_DRIFT, drift.get(0).getKind());
        assertEquals(CASH, drift.get(0).getSubjectCode());
        assertAmount("750.00", drift.get(0).getExpected());
        assertAmount("0.00", drift.get(0).getActual());
        assertAmount("750.00", cashBankRegisterService.findByCode(CASH_REGISTER).orElseThrow().getBalance());
    }

    @Test
    @DisplayName("Losing the race for a key returns the winner's entry and burns no entry number")
    void lostKeyRaceReturnsWinner() {
        // Given: another request already posted this key, but our lookup ran before it committed
        PostedEntry winner = postingEngine.post(saleInvoice("42"));
        doReturn(Optional.empty()).doCallRealMethod()
            .when(ledgerStore).findByIdempotencyKey(any());

        // When
        PostedEntry loser = postingEngine.post(saleInvoice("42"));

        // Then: the key constraint rejected the append and the winner came back
        assertTrue(loser.isDuplicate());
        assertEquals(winner.getId(), loser.getId());
        assertEquals(1, countRows("journal_entries"));
        assertEquals(3, countRows("journal_lines"));
        assertEquals(1, countRows("outbox_events"));
        assertAmount("2220000.00", balanceQueryService.balanceOf(RECEIVABLE));

        // And: the rolled back append gave its entry number back
        doCallRealMethod().when(ledgerStore).findByIdempotencyKey(any());
        PostedEntry next = postingEngine.post(salePayment("42"));
        assertEquals("SJ-2024-03-0002", next.getEntryNumber());
    }

    @Test
    @DisplayName("A repair that fails again stays queued with its attempt counted")
    void failedRepairStaysQueued() {
        // Given
        repairQueue.enqueue(accountId(RECEIVABLE), "manual");
        repairQueue.enqueue(accountId(RECEIVABLE), "manual again");
        doThrow(new IllegalStateException("projection store unavailable"))
            .when(balanceProjector).projectAccount(any());

        // When
        int repaired = reconciliationService.drainRepairQueue();

        // Then
        assertEquals(0, repaired);
        assertEquals(1, repairQueue.size());
        BalanceRepairQueue.Item item = repairQueue.nextBatch(10).get(0);
        assertEquals(accountId(RECEIVABLE), item.getAccountId());
        assertEquals(1, item.getAttempts());
        assertEquals("projection store unavailable", item.getReason());
    }
}
