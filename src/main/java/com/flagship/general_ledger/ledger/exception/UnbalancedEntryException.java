package com.flagship.general_ledger.ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Debit and credit totals of a proposal differ.
 *
 * The ledger never balances an entry on the caller's behalf: no rounding,
 * no plug line.
 */
@Getter
public class UnbalancedEntryException extends LedgerValidationException {

    private final BigDecimal debitTotal;
    private final BigDecimal creditTotal;

    public UnbalancedEntryException(BigDecimal debitTotal, BigDecimal creditTotal) {
        super(String.format("Journal entry is not balanced: debits=%s, credits=%s",
                debitTotal.toPlainString(), creditTotal.toPlainString()));
        this.debitTotal = debitTotal;
        this.creditTotal = creditTotal;
    }
}
