package com.flagship.general_ledger.projection;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One posted line of an account statement with the account's balance after it.
 */
@Value
public class AccountStatementLine {
    UUID entryId;
    String entryNumber;
    LocalDate entryDate;
    Instant postedAt;
    String description;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal runningBalance;
}
