package com.flagship.general_ledger.ledger.event;

import com.flagship.general_ledger.ledger.JournalEntry;
import com.flagship.general_ledger.ledger.JournalLine;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A journal entry became POSTED, either directly, from a draft, or as the
 * reversal of a voided entry.
 */
@Value
public class JournalPostedEvent implements JournalEvent {

    public static final String EVENT_TYPE = "JournalPosted";

    UUID eventId;
    UUID entryId;
    String entryNumber;
    LocalDate entryDate;
    String sourceType;
    String sourceId;
    String purpose;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    UUID reversedFrom;
    List<Line> lines;
    Instant occurredAt;

    @Value
    public static class Line {
        String accountCode;
        BigDecimal debit;
        BigDecimal credit;
    }

    public static JournalPostedEvent from(JournalEntry entry) {
        return new JournalPostedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getEntryNumber(),
            entry.getEntryDate(),
            entry.getIdempotencyKey().getSourceType().name(),
            entry.getIdempotencyKey().getSourceId(),
            entry.getIdempotencyKey().getPurpose(),
            entry.getTotalDebit(),
            entry.getTotalCredit(),
            entry.getReversedFrom(),
            entry.getLines().stream()
                .map(JournalPostedEvent::line)
                .toList(),
            entry.getPostedAt() != null ? entry.getPostedAt() : Instant.now()
        );
    }

    private static Line line(JournalLine line) {
        return new Line(line.getAccountCode(), line.getDebit(), line.getCredit());
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
