package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.LedgerTestSupport;
import com.flagship.general_ledger.ledger.EntryStatus;
import com.flagship.general_ledger.ledger.JournalEntry;
import com.flagship.general_ledger.ledger.LedgerStore;
import com.flagship.general_ledger.ledger.SourceType;
import com.flagship.general_ledger.ledger.VoidResult;
import com.flagship.general_ledger.ledger.event.JournalPostedEvent;
import com.flagship.general_ledger.ledger.event.JournalVoidedEvent;
import com.flagship.general_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.general_ledger.ledger.exception.IllegalEntryStateException;
import com.flagship.general_ledger.ledger.exception.LedgerValidationException;
import com.flagship.general_ledger.ledger.exception.UnbalancedEntryException;
import com.flagship.general_ledger.outbox.OutboxEvent;
import com.flagship.general_ledger.outbox.OutboxService;
import com.flagship.general_ledger.projection.AccountBalance;
import com.flagship.general_ledger.projection.BalanceProjector;
import com.flagship.general_ledger.projection.BalanceQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end posting tests: proposal in, journal, balances and mirror out.
 */
class PostingEngineTest extends LedgerTestSupport {

    @Autowired
    private PostingEngine postingEngine;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private BalanceQueryService balanceQueryService;

    @Autowired
    private BalanceProjector balanceProjector;

    @Autowired
    private OutboxService outboxService;

    @Nested
    @DisplayName("Posting")
    class Posting {

        @Test
        @DisplayName("Sale invoice is posted and projected to leaves and headers")
        void saleInvoiceIsPostedAndProjected() {
            // When
            PostedEntry posted = postingEngine.post(saleInvoice("42"));

            // Then: the entry is durable and balanced
            assertFalse(posted.isDuplicate());
            assertTrue(posted.isBalancesCurrent());
            JournalEntry entry = ledgerStore.getById(posted.getId());
            assertEquals(EntryStatus.POSTED, entry.getStatus());
            assertEquals("SJ-2024-03-0001", entry.getEntryNumber());
            assertNotNull(entry.getPostedAt());
            assertEquals(3, entry.getLines().size());
            assertAmount("2220000.00", entry.getTotalDebit());
            assertAmount("2220000.00", entry.getTotalCredit());

            // And: leaf balances follow the normal-balance convention
            assertAmount("2220000.00", balanceQueryService.balanceOf(RECEIVABLE));
            assertAmount("2000000.00", balanceQueryService.balanceOf(SALES_REVENUE));
            assertAmount("220000.00", balanceQueryService.balanceOf(TAX_PAYABLE));
            assertAmount("2000000.00", balanceQueryService.displayBalanceOf(SALES_REVENUE));

            // And: every ancestor is rolled up
            assertAmount("2220000.00", balanceQueryService.balanceOf(CURRENT_ASSETS));
            assertAmount("2220000.00", balanceQueryService.balanceOf(ASSETS));
            assertAmount("220000.00", balanceQueryService.balanceOf(CURRENT_LIABILITIES));
            assertAmount("220000.00", balanceQueryService.balanceOf(LIABILITIES));
            assertAmount("2000000.00", balanceQueryService.balanceOf(REVENUE));
        }

        @Test
        @DisplayName("Payment settles the receivable and refreshes the cash register")
        void paymentSettlesReceivableAndRefreshesMirror() {
            // Given
            postingEngine.post(saleInvoice("42"));

            // When
            PostedEntry payment = postingEngine.post(salePayment("42"));

            // Then
            assertTrue(payment.isBalancesCurrent());
            assertAmount("0.00", balanceQueryService.balanceOf(RECEIVABLE));
            assertAmount("2220000.00", balanceQueryService.balanceOf(CASH));
            assertAmount("2220000.00", balanceQueryService.balanceOf(CURRENT_ASSETS));
            assertAmount("2220000.00", cashBankRegisterService.findByCode(CASH_REGISTER).orElseThrow().getBalance());
        }

        @Test
        @DisplayName("Unbalanced entry is rejected and nothing is written")
        void unbalancedEntryIsRejected() {
            // Given
            JournalEntryProposal proposal = JournalEntryProposal.builder()
                .sourceType(SourceType.MANUAL)
                .sourceId("M-1")
                .purpose("ADJUST")
                .entryDate(ENTRY_DATE)
                .description("Off by ten")
                .line(ProposedLine.debit(CASH, "100.00"))
                .line(ProposedLine.credit(SALES_REVENUE, "90.00"))
                .build();

            // When / Then
            UnbalancedEntryException e = assertThrows(UnbalancedEntryException.class,
                    () -> postingEngine.post(proposal));
            assertTrue(e.getMessage().contains("100"));

            assertEquals(0, countRows("journal_entries"));
            assertEquals(0, countRows("journal_lines"));
            assertEquals(0, countRows("outbox_events"));
            assertTrue(balanceQueryService.allBalances().isEmpty());
        }

        @Test
        @DisplayName("Posting the same key twice yields one entry")
        void samePostingKeyTwiceYieldsOneEntry() {
            // When
            PostedEntry first = postingEngine.post(saleInvoice("42"));
            PostedEntry second = postingEngine.post(saleInvoice("42"));

            // Then
            assertFalse(first.isDuplicate());
            assertTrue(second.isDuplicate());
            assertEquals(first.getId(), second.getId());
            assertEquals(first.getEntryNumber(), second.getEntryNumber());
            assertEquals(1, countRows("journal_entries"));
            assertEquals(1, outboxService.getEventsForEntry(first.getId()).size());
            assertAmount("2220000.00", balanceQueryService.balanceOf(RECEIVABLE));
        }

        @Test
        @DisplayName("Distinct purposes of one source record are distinct postings")
        void distinctPurposesAreDistinctPostings() {
            PostedEntry invoice = postingEngine.post(saleInvoice("42"));
            PostedEntry payment = postingEngine.post(salePayment("42"));

            assertNotEquals(invoice.getId(), payment.getId());
            assertFalse(payment.isDuplicate());
            assertEquals(2, countRows("journal_entries"));
            assertEquals("SJ-2024-03-0002", payment.getEntryNumber());
        }

        @Test
        @DisplayName("Posting to a header account is rejected")
        void postingToHeaderIsRejected() {
            JournalEntryProposal proposal = twoLine(SourceType.MANUAL, "M-2", "ADJUST",
                    CURRENT_ASSETS, CAPITAL, "500.00");

            LedgerValidationException e = assertThrows(LedgerValidationException.class,
                    () -> postingEngine.post(proposal));
            assertTrue(e.getMessage().contains("header"));
            assertEquals(0, countRows("journal_entries"));
        }

        @Test
        @DisplayName("Posting to a retired account is rejected")
        void postingToRetiredAccountIsRejected() {
            chartOfAccountsService.retireAccount(OPERATING_EXPENSES);

            JournalEntryProposal proposal = twoLine(SourceType.MANUAL, "M-3", "EXPENSE",
                    OPERATING_EXPENSES, CASH, "75.00");

            LedgerValidationException e = assertThrows(LedgerValidationException.class,
                    () -> postingEngine.post(proposal));
            assertTrue(e.getMessage().contains("inactive"));
            assertEquals(0, countRows("journal_entries"));
        }

        @Test
        @DisplayName("Unknown account code is rejected")
        void unknownAccountIsRejected() {
            JournalEntryProposal proposal = twoLine(SourceType.MANUAL, "M-4", "ADJUST",
                    "9999", CASH, "10.00");

            assertThrows(AccountNotFoundException.class, () -> postingEngine.post(proposal));
            assertEquals(0, countRows("journal_entries"));
        }

        @Test
        @DisplayName("Malformed lines are rejected before any write")
        void malformedLinesAreRejected() {
            JournalEntryProposal bothSides = JournalEntryProposal.builder()
                .sourceType(SourceType.MANUAL).sourceId("M-5").purpose("ADJUST")
                .entryDate(ENTRY_DATE).description("Both sides")
                .line(ProposedLine.of(CASH, new BigDecimal("10.00"), new BigDecimal("10.00"), null))
                .line(ProposedLine.credit(CAPITAL, "10.00"))
                .build();
            JournalEntryProposal negative = twoLine(SourceType.MANUAL, "M-6", "ADJUST", CASH, CAPITAL, "-10.00");
            JournalEntryProposal zero = twoLine(SourceType.MANUAL, "M-7", "ADJUST", CASH, CAPITAL, "0.00");
            JournalEntryProposal tooPrecise = twoLine(SourceType.MANUAL, "M-8", "ADJUST", CASH, CAPITAL, "10.005");
            JournalEntryProposal singleLine = JournalEntryProposal.builder()
                .sourceType(SourceType.MANUAL).sourceId("M-9").purpose("ADJUST")
                .entryDate(ENTRY_DATE).description("One line")
                .line(ProposedLine.debit(CASH, "10.00"))
                .build();
            JournalEntryProposal noSourceId = twoLine(SourceType.MANUAL, " ", "ADJUST", CASH, CAPITAL, "10.00");

            for (JournalEntryProposal proposal : List.of(bothSides, negative, zero, tooPrecise, singleLine, noSourceId)) {
                assertThrows(LedgerValidationException.class, () -> postingEngine.post(proposal),
                        () -> "expected rejection of " + proposal);
            }
            assertEquals(0, countRows("journal_entries"));
        }

        @Test
        @DisplayName("Full rematerialization reproduces the incrementally projected balances")
        void rematerializationMatchesIncrementalProjection() {
            // Given
            postingEngine.post(saleInvoice("42"));
            postingEngine.post(salePayment("42"));
            Map<UUID, AccountBalance> incremental = balanceQueryService.allBalances();

            // When
            balanceProjector.rematerializeAll();
            Map<UUID, AccountBalance> rebuilt = balanceQueryService.allBalances();

            // Then
            for (String code : List.of(RECEIVABLE, CASH, SALES_REVENUE, TAX_PAYABLE, CURRENT_ASSETS, ASSETS, REVENUE)) {
                UUID id = accountId(code);
                assertEquals(0, incremental.get(id).getBalance().compareTo(rebuilt.get(id).getBalance()),
                        "balance of " + code);
                assertTrue(incremental.get(id).sameFigures(rebuilt.get(id)), "figures of " + code);
            }
            assertAmount("0.00", rebuilt.get(accountId(RECEIVABLE)).getBalance());
            assertAmount("2220000.00", rebuilt.get(accountId(CASH)).getBalance());
        }

        @Test
        @DisplayName("Posting writes a JournalPosted outbox event in the same transaction")
        void postingWritesOutboxEvent() {
            PostedEntry posted = postingEngine.post(saleInvoice("42"));

            List<OutboxEvent> events = outboxService.getEventsForEntry(posted.getId());
            assertEquals(1, events.size());
            assertEquals(JournalPostedEvent.EVENT_TYPE, events.get(0).getEventType());
            assertTrue(events.get(0).getPayload().contains(posted.getEntryNumber()));
            assertFalse(events.get(0).isPublished());
        }
    }

    @Nested
    @DisplayName("Drafts")
    class Drafts {

        @Test
        @DisplayName("An unbalanced draft is stored without touching balances")
        void unbalancedDraftIsStored() {
            JournalEntryProposal proposal = JournalEntryProposal.builder()
                .sourceType(SourceType.PURCHASE).sourceId("P-7").purpose("BILL")
                .entryDate(ENTRY_DATE).description("Supplier bill, tax line pending")
                .line(ProposedLine.debit(COGS, "1000.00"))
                .line(ProposedLine.credit(CASH, "900.00"))
                .build();

            JournalEntry draft = postingEngine.draft(proposal);

            assertEquals(EntryStatus.DRAFT, draft.getStatus());
            assertNull(draft.getPostedAt());
            assertEquals("PJ-2024-03-0001", draft.getEntryNumber());
            assertTrue(balanceQueryService.allBalances().isEmpty());
            assertTrue(outboxService.getEventsForEntry(draft.getId()).isEmpty());
            assertThrows(UnbalancedEntryException.class, () -> postingEngine.postDraft(draft.getId()));
            assertEquals(EntryStatus.DRAFT, ledgerStore.getById(draft.getId()).getStatus());
        }

        @Test
        @DisplayName("A balanced draft is promoted and projected")
        void balancedDraftIsPromoted() {
            JournalEntry draft = postingEngine.draft(
                twoLine(SourceType.PURCHASE, "P-8", "BILL", COGS, CASH, "1500.00"));

            PostedEntry posted = postingEngine.postDraft(draft.getId());

            assertFalse(posted.isDuplicate());
            assertEquals(draft.getId(), posted.getId());
            assertEquals(draft.getEntryNumber(), posted.getEntryNumber());
            assertEquals(EntryStatus.POSTED, posted.getEntry().getStatus());
            assertAmount("1500.00", balanceQueryService.balanceOf(COGS));
            assertAmount("-1500.00", balanceQueryService.balanceOf(CASH));
            assertAmount("-1500.00", cashBankRegisterService.findByCode(CASH_REGISTER).orElseThrow().getBalance());
            assertEquals(1, outboxService.getEventsForEntry(draft.getId()).size());

            // Promoting again returns the posted entry
            PostedEntry again = postingEngine.postDraft(draft.getId());
            assertTrue(again.isDuplicate());
            assertEquals(draft.getId(), again.getId());
        }

        @Test
        @DisplayName("A draft whose key is already posted returns the posted entry and stays a draft")
        void draftWithPostedKeyReturnsExistingEntry() {
            JournalEntry draft = postingEngine.draft(saleInvoice("42"));
            PostedEntry direct = postingEngine.post(saleInvoice("42"));

            PostedEntry result = postingEngine.postDraft(draft.getId());

            assertTrue(result.isDuplicate());
            assertEquals(direct.getId(), result.getId());
            assertEquals(EntryStatus.DRAFT, ledgerStore.getById(draft.getId()).getStatus());
            assertAmount("2220000.00", balanceQueryService.balanceOf(RECEIVABLE));
        }
    }

    @Nested
    @DisplayName("Voiding")
    class Voiding {

        @Test
        @DisplayName("Void reverses every line and nets balances back to zero")
        void voidReversesEntry() {
            PostedEntry payment = postingEngine.post(
                twoLine(SourceType.CASH_BANK, "CB-1", "DEPOSIT", CASH, CAPITAL, "5000.00"));
            assertAmount("5000.00", balanceQueryService.balanceOf(CASH));

            VoidResult result = postingEngine.voidEntry(payment.getId(), "Deposit recorded twice");

            assertFalse(result.isAlreadyVoided());
            JournalEntry original = result.getOriginal();
            JournalEntry reversal = result.getReversal();
            assertEquals(EntryStatus.VOID, original.getStatus());
            assertEquals("Deposit recorded twice", original.getVoidReason());
            assertEquals(reversal.getId(), original.getReversedBy());
            assertEquals(original.getId(), reversal.getReversedFrom());
            assertEquals(EntryStatus.POSTED, reversal.getStatus());
            assertTrue(reversal.getEntryNumber().startsWith("RV-"));
            assertEquals(LocalDate.now(), reversal.getEntryDate());
            assertTrue(reversal.getDescription().startsWith("REVERSAL: "));
            assertAmount("5000.00", reversal.getLines().get(0).getCredit());
            assertAmount("5000.00", reversal.getLines().get(1).getDebit());

            assertAmount("0.00", balanceQueryService.balanceOf(CASH));
            assertAmount("0.00", balanceQueryService.balanceOf(CAPITAL));
            assertAmount("0.00", cashBankRegisterService.findByCode(CASH_REGISTER).orElseThrow().getBalance());

            List<OutboxEvent> originalEvents = outboxService.getEventsForEntry(original.getId());
            assertEquals(List.of(JournalPostedEvent.EVENT_TYPE, JournalVoidedEvent.EVENT_TYPE),
                    originalEvents.stream().map(OutboxEvent::getEventType).toList());
            assertEquals(1, outboxService.getEventsForEntry(reversal.getId()).size());
        }

        @Test
        @DisplayName("Voiding releases the key so the event can be posted again")
        void voidReleasesPostingKey() {
            PostedEntry first = postingEngine.post(saleInvoice("42"));
            postingEngine.voidEntry(first.getId(), "Wrong customer");

            PostedEntry corrected = postingEngine.post(saleInvoice("42"));

            assertFalse(corrected.isDuplicate());
            assertNotEquals(first.getId(), corrected.getId());
            assertEquals(corrected.getId(),
                    ledgerStore.findByIdempotencyKey(saleInvoice("42").idempotencyKey()).orElseThrow().getId());
            assertAmount("2220000.00", balanceQueryService.balanceOf(RECEIVABLE));
        }

        @Test
        @DisplayName("Voiding twice returns the first reversal")
        void voidIsIdempotent() {
            PostedEntry posted = postingEngine.post(saleInvoice("42"));
            VoidResult first = postingEngine.voidEntry(posted.getId(), "Cancelled");

            VoidResult second = postingEngine.voidEntry(posted.getId(), "Cancelled again");

            assertTrue(second.isAlreadyVoided());
            assertEquals(first.getReversal().getId(), second.getReversal().getId());
            assertEquals("Cancelled", second.getOriginal().getVoidReason());
            assertEquals(2, countRows("journal_entries"));
        }

        @Test
        @DisplayName("Reversals and drafts cannot be voided, and a reason is required")
        void invalidVoidsAreRejected() {
            PostedEntry posted = postingEngine.post(saleInvoice("42"));
            VoidResult voided = postingEngine.voidEntry(posted.getId(), "Cancelled");
            JournalEntry draft = postingEngine.draft(salePayment("42"));

            assertThrows(IllegalEntryStateException.class,
                    () -> postingEngine.voidEntry(voided.getReversal().getId(), "Undo the undo"));
            assertThrows(IllegalEntryStateException.class,
                    () -> postingEngine.voidEntry(draft.getId(), "Not posted yet"));
            assertThrows(LedgerValidationException.class,
                    () -> postingEngine.voidEntry(posted.getId(), "  "));
        }
    }
}
