package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.account.AccountDirectory;
import com.flagship.general_ledger.ledger.IdempotencyKey;
import com.flagship.general_ledger.ledger.JournalEntry;
import com.flagship.general_ledger.ledger.JournalLine;
import com.flagship.general_ledger.ledger.LedgerStore;
import com.flagship.general_ledger.ledger.NewJournalEntry;
import com.flagship.general_ledger.ledger.VoidResult;
import com.flagship.general_ledger.ledger.event.JournalPostedEvent;
import com.flagship.general_ledger.ledger.event.JournalVoidedEvent;
import com.flagship.general_ledger.ledger.exception.DuplicatePostingException;
import com.flagship.general_ledger.ledger.exception.JournalEntryNotFoundException;
import com.flagship.general_ledger.ledger.exception.LedgerValidationException;
import com.flagship.general_ledger.ledger.exception.UnbalancedEntryException;
import com.flagship.general_ledger.mirror.OperationalMirrorAdapter;
import com.flagship.general_ledger.observability.CorrelationContext;
import com.flagship.general_ledger.observability.LedgerMetrics;
import com.flagship.general_ledger.outbox.OutboxService;
import com.flagship.general_ledger.projection.BalanceProjector;
import com.flagship.general_ledger.reconciliation.BalanceRepairQueue;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The single path by which money enters the ledger.
 *
 * {@link #post} works in two phases:
 * 1. Validate, check the idempotency key, then append the entry and its
 *    outbox event in one transaction. A rejection here leaves nothing behind.
 * 2. After commit, project the touched accounts and their ancestors, then
 *    refresh the operational mirrors of touched accounts.
 *
 * A failure in phase 2 never undoes phase 1: the entry stands, the accounts
 * are queued for repair and the result reports stale balances.
 *
 * Two concurrent posts for one key race on the posting-key primary key;
 * the loser rolls back and returns the winner's entry.
 */
@Service
@Slf4j
public class PostingEngine {

    private final ProposalResolver proposalResolver;
    private final AccountDirectory accountDirectory;
    private final LedgerStore ledgerStore;
    private final BalanceProjector balanceProjector;
    private final OperationalMirrorAdapter mirrorAdapter;
    private final BalanceRepairQueue repairQueue;
    private final OutboxService outboxService;
    private final PostingKeyCache postingKeyCache;
    private final LedgerMetrics ledgerMetrics;
    private final TransactionTemplate transactionTemplate;

    public PostingEngine(ProposalResolver proposalResolver,
                         AccountDirectory accountDirectory,
                         LedgerStore ledgerStore,
                         BalanceProjector balanceProjector,
                         OperationalMirrorAdapter mirrorAdapter,
                         BalanceRepairQueue repairQueue,
                         OutboxService outboxService,
                         PostingKeyCache postingKeyCache,
                         LedgerMetrics ledgerMetrics,
                         PlatformTransactionManager transactionManager) {
        this.proposalResolver = proposalResolver;
        this.accountDirectory = accountDirectory;
        this.ledgerStore = ledgerStore;
        this.balanceProjector = balanceProjector;
        this.mirrorAdapter = mirrorAdapter;
        this.repairQueue = repairQueue;
        this.outboxService = outboxService;
        this.postingKeyCache = postingKeyCache;
        this.ledgerMetrics = ledgerMetrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Posts a proposal, or returns the entry already posted for its key.
     *
     * @throws LedgerValidationException if the proposal is malformed or names
     *         an unknown, inactive or header account
     * @throws UnbalancedEntryException if debits and credits differ
     */
    public PostedEntry post(JournalEntryProposal proposal) {
        long startTime = System.currentTimeMillis();
        String sourceType = proposal != null && proposal.getSourceType() != null
            ? proposal.getSourceType().name() : null;
        boolean owner = CorrelationContext.open();
        try {
            NewJournalEntry resolved = proposalResolver.resolve(proposal, true);
            IdempotencyKey key = resolved.getIdempotencyKey();
            log.info("Posting journal entry: key={}, lines={}, total={}",
                    key, resolved.getLines().size(), resolved.totalDebit().toPlainString());

            Optional<JournalEntry> existing = findPosted(key);
            if (existing.isPresent()) {
                return duplicateOf(existing.get(), sourceType);
            }

            JournalEntry entry;
            try {
                entry = transactionTemplate.execute(status -> {
                    JournalEntry appended = ledgerStore.append(resolved);
                    outboxService.saveEvent(JournalPostedEvent.from(appended));
                    return appended;
                });
            } catch (DuplicatePostingException | DataIntegrityViolationException | ConcurrencyFailureException e) {
                // Lost the race for the key; the winner's entry is committed by now.
                Optional<JournalEntry> winner = ledgerStore.findByIdempotencyKey(key);
                if (winner.isEmpty()) {
                    throw e;
                }
                return duplicateOf(winner.get(), sourceType);
            }

            MDC.put(CorrelationContext.ENTRY_NUMBER_MDC_KEY, entry.getEntryNumber());
            postingKeyCache.remember(key, entry.getId());
            boolean balancesCurrent = refreshDerived(entry);

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordPosting(sourceType, LedgerMetrics.STATUS_POSTED);
            ledgerMetrics.recordPostingLatency("post", Duration.ofMillis(duration));
            log.info("Journal entry posted: entryId={}, total={}, balancesCurrent={}, duration={}ms",
                    entry.getId(), entry.getTotalDebit().toPlainString(), balancesCurrent, duration);
            return new PostedEntry(entry, false, balancesCurrent);

        } catch (UnbalancedEntryException e) {
            ledgerMetrics.recordPosting(sourceType, LedgerMetrics.STATUS_REJECTED_UNBALANCED);
            log.warn("Journal entry rejected: {}", e.getMessage());
            throw e;
        } catch (LedgerValidationException e) {
            ledgerMetrics.recordPosting(sourceType, LedgerMetrics.STATUS_REJECTED_VALIDATION);
            log.warn("Journal entry rejected: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordPosting(sourceType, LedgerMetrics.STATUS_ERROR);
            log.error("Journal entry posting failed: error={}", e.getMessage());
            throw e;
        } finally {
            CorrelationContext.close(owner);
        }
    }

    /**
     * Stores a proposal as a DRAFT. Accounts and amounts are validated; the
     * entry need not balance yet and no balance changes.
     */
    public JournalEntry draft(JournalEntryProposal proposal) {
        String sourceType = proposal != null && proposal.getSourceType() != null
            ? proposal.getSourceType().name() : null;
        boolean owner = CorrelationContext.open();
        try {
            NewJournalEntry resolved = proposalResolver.resolve(proposal, false);
            JournalEntry draft = transactionTemplate.execute(status -> ledgerStore.saveDraft(resolved));

            MDC.put(CorrelationContext.ENTRY_NUMBER_MDC_KEY, draft.getEntryNumber());
            ledgerMetrics.recordPosting(sourceType, LedgerMetrics.STATUS_DRAFTED);
            log.info("Draft journal entry saved: entryId={}, key={}", draft.getId(), draft.getIdempotencyKey());
            return draft;
        } catch (LedgerValidationException e) {
            ledgerMetrics.recordPosting(sourceType, LedgerMetrics.STATUS_REJECTED_VALIDATION);
            log.warn("Draft journal entry rejected: {}", e.getMessage());
            throw e;
        } finally {
            CorrelationContext.close(owner);
        }
    }

    /**
     * Promotes a draft to POSTED under the rules of {@link #post}: its lines
     * must balance, its accounts must still be postable, and if its key is
     * already posted the existing entry is returned and the draft is left as is.
     *
     * @throws com.flagship.general_ledger.ledger.exception.IllegalEntryStateException
     *         if the entry is VOID
     */
    public PostedEntry postDraft(UUID entryId) {
        long startTime = System.currentTimeMillis();
        boolean owner = CorrelationContext.open();
        String sourceType = null;
        try {
            JournalEntry draft = ledgerStore.findById(entryId)
                .orElseThrow(() -> new JournalEntryNotFoundException(entryId));
            sourceType = draft.getIdempotencyKey().getSourceType().name();
            MDC.put(CorrelationContext.ENTRY_NUMBER_MDC_KEY, draft.getEntryNumber());
            if (draft.isPosted()) {
                return duplicateOf(draft, sourceType);
            }
            if (draft.isDraft()) {
                for (JournalLine line : draft.getLines()) {
                    accountDirectory.requirePostable(line.getAccountCode());
                }
                Optional<JournalEntry> existing = findPosted(draft.getIdempotencyKey());
                if (existing.isPresent()) {
                    return duplicateOf(existing.get(), sourceType);
                }
            }

            JournalEntry entry;
            try {
                entry = transactionTemplate.execute(status -> {
                    JournalEntry promoted = ledgerStore.promoteDraft(entryId);
                    outboxService.saveEvent(JournalPostedEvent.from(promoted));
                    return promoted;
                });
            } catch (DuplicatePostingException | DataIntegrityViolationException | ConcurrencyFailureException e) {
                Optional<JournalEntry> winner = ledgerStore.findByIdempotencyKey(draft.getIdempotencyKey());
                if (winner.isEmpty()) {
                    throw e;
                }
                return duplicateOf(winner.get(), sourceType);
            }

            postingKeyCache.remember(entry.getIdempotencyKey(), entry.getId());
            boolean balancesCurrent = refreshDerived(entry);

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordPosting(sourceType, LedgerMetrics.STATUS_POSTED);
            ledgerMetrics.recordPostingLatency("post_draft", Duration.ofMillis(duration));
            log.info("Draft journal entry posted: entryId={}, balancesCurrent={}, duration={}ms",
                    entry.getId(), balancesCurrent, duration);
            return new PostedEntry(entry, false, balancesCurrent);

        } catch (UnbalancedEntryException e) {
            ledgerMetrics.recordPosting(sourceType, LedgerMetrics.STATUS_REJECTED_UNBALANCED);
            log.warn("Draft journal entry rejected: {}", e.getMessage());
            throw e;
        } catch (LedgerValidationException e) {
            ledgerMetrics.recordPosting(sourceType, LedgerMetrics.STATUS_REJECTED_VALIDATION);
            log.warn("Draft journal entry rejected: {}", e.getMessage());
            throw e;
        } finally {
            CorrelationContext.close(owner);
        }
    }

    /**
     * Voids a posted entry with a reversing entry dated today and projects
     * the touched accounts. The business event may then be posted again
     * under its original key. Voiding twice returns the first reversal.
     *
     * @throws com.flagship.general_ledger.ledger.exception.IllegalEntryStateException
     *         for drafts and reversing entries
     */
    public VoidResult voidEntry(UUID entryId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new LedgerValidationException("Void reason is required");
        }
        long startTime = System.currentTimeMillis();
        boolean owner = CorrelationContext.open();
        try {
            VoidResult result = transactionTemplate.execute(status -> {
                VoidResult voided = ledgerStore.voidEntry(entryId, reason.trim(), LocalDate.now());
                if (!voided.isAlreadyVoided()) {
                    outboxService.saveEvent(JournalVoidedEvent.from(voided));
                    outboxService.saveEvent(JournalPostedEvent.from(voided.getReversal()));
                }
                return voided;
            });

            JournalEntry original = result.getOriginal();
            MDC.put(CorrelationContext.ENTRY_NUMBER_MDC_KEY, original.getEntryNumber());
            if (result.isAlreadyVoided()) {
                log.info("Journal entry already void: reversal={}",
                        result.getReversal() != null ? result.getReversal().getEntryNumber() : null);
                return result;
            }

            postingKeyCache.forget(original.getIdempotencyKey());
            postingKeyCache.remember(result.getReversal().getIdempotencyKey(), result.getReversal().getId());
            boolean balancesCurrent = refreshDerived(result.getReversal());

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordPosting(original.getIdempotencyKey().getSourceType().name(),
                    LedgerMetrics.STATUS_VOIDED);
            ledgerMetrics.recordPostingLatency("void", Duration.ofMillis(duration));
            log.info("Journal entry voided: reversal={}, reason={}, balancesCurrent={}, duration={}ms",
                    result.getReversal().getEntryNumber(), reason, balancesCurrent, duration);
            return result;
        } finally {
            CorrelationContext.close(owner);
        }
    }

    private Optional<JournalEntry> findPosted(IdempotencyKey key) {
        Optional<JournalEntry> cached = postingKeyCache.find(key)
            .flatMap(ledgerStore::findById)
            .filter(e -> e.isPosted() && e.getIdempotencyKey().equals(key));
        if (cached.isPresent()) {
            return cached;
        }
        return ledgerStore.findByIdempotencyKey(key);
    }

    private PostedEntry duplicateOf(JournalEntry existing, String sourceType) {
        ledgerMetrics.recordPosting(sourceType, LedgerMetrics.STATUS_DUPLICATE);
        log.info("Journal entry already posted for key {}: entryNumber={}",
                existing.getIdempotencyKey(), existing.getEntryNumber());
        return new PostedEntry(existing, true, true);
    }

    /**
     * Projects balances and refreshes mirrors for an entry that is already
     * committed. Failures are queued for repair, never rethrown.
     *
     * @return whether every balance and mirror was refreshed
     */
    private boolean refreshDerived(JournalEntry entry) {
        Set<UUID> touched = entry.touchedAccountIds();
        try {
            balanceProjector.projectAffected(touched);
        } catch (RuntimeException e) {
            ledgerMetrics.recordProjectionFailure();
            log.error("Balance projection failed after commit, queueing for repair: error={}", e.getMessage(), e);
            touched.forEach(accountId -> queueRepair(accountId, "projection failed: " + e.getMessage()));
            return false;
        }

        boolean current = true;
        for (UUID accountId : touched) {
            if (!mirrorAdapter.hasMirror(accountId)) {
                continue;
            }
            try {
                mirrorAdapter.refresh(accountId);
            } catch (RuntimeException e) {
                current = false;
                ledgerMetrics.recordMirrorFailure();
                log.error("Mirror refresh failed after commit, queueing for repair: account={}, error={}",
                        accountId, e.getMessage());
                queueRepair(accountId, "mirror refresh failed: " + e.getMessage());
            }
        }
        return current;
    }

    private void queueRepair(UUID accountId, String reason) {
        try {
            repairQueue.enqueue(accountId, reason);
        } catch (RuntimeException e) {
            log.error("Could not queue account {} for repair; the next reconciliation will rebuild it: {}",
                    accountId, e.getMessage());
        }
    }
}
