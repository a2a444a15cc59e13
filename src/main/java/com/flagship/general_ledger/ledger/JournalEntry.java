package com.flagship.general_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A journal entry as stored, with its lines in line-number order.
 *
 * Entries are never updated in place apart from the lifecycle columns
 * (status, posted_at and the reversal links). Corrections are made with
 * reversing entries.
 */
@Value
public class JournalEntry {
    UUID id;
    String entryNumber;
    LocalDate entryDate;
    String description;
    IdempotencyKey idempotencyKey;
    EntryStatus status;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    Instant postedAt;
    UUID reversedBy;
    UUID reversedFrom;
    String voidReason;
    Instant createdAt;
    List<JournalLine> lines;

    public boolean isPosted() {
        return status == EntryStatus.POSTED;
    }

    public boolean isDraft() {
        return status == EntryStatus.DRAFT;
    }

    public boolean isVoid() {
        return status == EntryStatus.VOID;
    }

    public boolean isReversal() {
        return reversedFrom != null;
    }

    public boolean isBalanced() {
        return totalDebit.compareTo(totalCredit) == 0;
    }

    /**
     * Distinct accounts referenced by the lines, in line order.
     */
    public Set<UUID> touchedAccountIds() {
        Set<UUID> ids = new LinkedHashSet<>();
        for (JournalLine line : lines) {
            ids.add(line.getAccountId());
        }
        return ids;
    }
}
