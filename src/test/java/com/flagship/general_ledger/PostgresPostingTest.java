package com.flagship.general_ledger;

import com.flagship.general_ledger.ledger.EntryStatus;
import com.flagship.general_ledger.ledger.LedgerStore;
import com.flagship.general_ledger.ledger.SourceType;
import com.flagship.general_ledger.outbox.OutboxService;
import com.flagship.general_ledger.posting.PostedEntry;
import com.flagship.general_ledger.posting.PostingEngine;
import com.flagship.general_ledger.projection.BalanceProjector;
import com.flagship.general_ledger.projection.BalanceQueryService;
import com.flagship.general_ledger.reconciliation.LedgerReconciliationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Posting against PostgreSQL, where concurrent writers really contend for
 * the idempotency key and the entry number counter.
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresPostingTest extends LedgerTestSupport {

    private static final int THREADS = 8;

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("general_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Autowired
    private PostingEngine postingEngine;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private BalanceProjector balanceProjector;

    @Autowired
    private BalanceQueryService balanceQueryService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private LedgerReconciliationService reconciliationService;

    @Test
    @DisplayName("Sale, payment and void settle to the expected balances")
    void saleLifecycle() {
        // Given
        PostedEntry invoice = postingEngine.post(saleInvoice("42"));
        postingEngine.post(salePayment("42"));

        // Then
        assertEquals("SJ-2024-03-0001", invoice.getEntryNumber());
        assertAmount("2220000.00", balanceQueryService.balanceOf(CASH));
        assertAmount("2220000.00", cashBankRegisterService.findByCode(CASH_REGISTER).orElseThrow().getBalance());
        assertAmount("2000000.00", balanceQueryService.balanceOf(REVENUE));

        // When
        postingEngine.voidEntry(invoice.getId(), "Cancelled");

        // Then
        assertAmount("0.00", balanceQueryService.balanceOf(SALES_REVENUE));
        assertAmount("-2220000.00", balanceQueryService.balanceOf(RECEIVABLE));
        assertTrue(balanceQueryService.trialBalance().isBalanced());
        assertTrue(reconciliationService.reconcile().isClean());
    }

    @Test
    @DisplayName("Concurrent submissions of one key post exactly one entry")
    void concurrentSameKey() throws Exception {
        List<PostedEntry> results = runConcurrently(i -> postingEngine.post(saleInvoice("42")));

        long winners = results.stream().filter(r -> !r.isDuplicate()).count();
        Set<UUID> ids = new HashSet<>();
        results.forEach(r -> ids.add(r.getId()));

        assertEquals(1, winners);
        assertEquals(1, ids.size());
        assertEquals(1, ledgerStore.countEntries(EntryStatus.POSTED));
        assertEquals(1, outboxService.countUnpublished());
        assertAmount("2220000.00", balanceQueryService.balanceOf(RECEIVABLE));
    }

    @Test
    @DisplayName("Concurrent distinct postings get gapless numbers and converge on the right balances")
    void concurrentDistinctKeys() throws Exception {
        List<PostedEntry> results = runConcurrently(i ->
            postingEngine.post(twoLine(SourceType.CASH_BANK, "CB-" + i, "DEPOSIT", CASH, CAPITAL, "10.00")));

        Set<String> numbers = new HashSet<>();
        results.forEach(r -> numbers.add(r.getEntryNumber()));
        Set<String> expected = new HashSet<>();
        for (int i = 1; i <= THREADS; i++) {
            expected.add(String.format("CB-2024-03-%04d", i));
        }
        assertEquals(expected, numbers);

        // Rollups may lag under contention until the next projection
        balanceProjector.projectAffected(List.of(accountId(CASH), accountId(CAPITAL)));
        assertAmount("80.00", balanceQueryService.balanceOf(CASH));
        assertAmount("80.00", balanceQueryService.balanceOf(ASSETS));
        assertTrue(balanceProjector.verifyLeaves().isEmpty());
        assertTrue(balanceProjector.verifyRollups().isEmpty());
    }

    private interface Posting {
        PostedEntry post(int index);
    }

    private List<PostedEntry> runConcurrently(Posting posting) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<PostedEntry>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                int index = i;
                Callable<PostedEntry> task = () -> {
                    start.await();
                    return posting.post(index);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            List<PostedEntry> results = new ArrayList<>();
            for (Future<PostedEntry> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
