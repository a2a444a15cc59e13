package com.flagship.general_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A validated entry ready to be appended: accounts are resolved to ids and
 * amounts are normalized to two decimals.
 */
@Value
public class NewJournalEntry {
    LocalDate entryDate;
    String description;
    IdempotencyKey idempotencyKey;
    List<Line> lines;
    UUID reversedFrom;

    @Value
    public static class Line {
        UUID accountId;
        String accountCode;
        BigDecimal debit;
        BigDecimal credit;
        String description;
    }

    public BigDecimal totalDebit() {
        return lines.stream().map(Line::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalCredit() {
        return lines.stream().map(Line::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Entry-number prefix: reversals use their own series.
     */
    public String entryPrefix() {
        return reversedFrom != null ? SourceType.REVERSAL_PREFIX : idempotencyKey.getSourceType().entryPrefix();
    }
}
