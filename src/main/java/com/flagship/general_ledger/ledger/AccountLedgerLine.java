package com.flagship.general_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A journal line seen from one account, with the header fields of its entry.
 */
@Value
public class AccountLedgerLine {
    UUID lineId;
    UUID entryId;
    String entryNumber;
    LocalDate entryDate;
    EntryStatus status;
    Instant postedAt;
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String description;
}
