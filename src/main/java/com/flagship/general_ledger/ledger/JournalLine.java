package com.flagship.general_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One side of a journal entry against a single leaf account. Exactly one of
 * {@code debit} and {@code credit} is positive, the other is zero.
 */
@Value
public class JournalLine {
    UUID id;
    UUID entryId;
    int lineNumber;
    UUID accountId;
    String accountCode;
    BigDecimal debit;
    BigDecimal credit;
    String description;

    public boolean isDebit() {
        return debit.signum() > 0;
    }

    /**
     * The positive amount on whichever side this line carries.
     */
    public BigDecimal amount() {
        return isDebit() ? debit : credit;
    }
}
