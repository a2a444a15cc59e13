package com.flagship.general_ledger.account;

import com.flagship.general_ledger.ledger.exception.LedgerValidationException;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Closed set of account classes.
 *
 * The normal balance side is fixed per class and never overridden per account:
 * ASSET and EXPENSE accounts increase on debit, LIABILITY, EQUITY and REVENUE
 * accounts increase on credit.
 */
public enum AccountClass {
    ASSET(true),
    LIABILITY(false),
    EQUITY(false),
    REVENUE(false),
    EXPENSE(true);

    private static final BigDecimal NEGATIVE_ONE = BigDecimal.ONE.negate();

    private final boolean debitNormal;

    AccountClass(boolean debitNormal) {
        this.debitNormal = debitNormal;
    }

    public boolean isDebitNormal() {
        return debitNormal;
    }

    /**
     * +1 for debit-normal classes, -1 for credit-normal classes.
     */
    public BigDecimal normalSign() {
        return debitNormal ? BigDecimal.ONE : NEGATIVE_ONE;
    }

    /**
     * Balance of an account of this class from its debit and credit totals:
     * {@code normalSign * (debits - credits)}.
     */
    public BigDecimal signedBalance(BigDecimal debits, BigDecimal credits) {
        return normalSign().multiply(debits.subtract(credits));
    }

    /**
     * Report-facing figure. Credit-normal classes are shown as an absolute
     * value; debit-normal classes as stored. Apply only after aggregation.
     */
    public BigDecimal toDisplay(BigDecimal balance) {
        return debitNormal ? balance : balance.abs();
    }

    /**
     * Parses a class name at the boundary, ignoring case and surrounding
     * whitespace ("Revenue", "REVENUE" and " revenue " are the same class).
     */
    public static AccountClass parse(String value) {
        if (value == null || value.isBlank()) {
            throw new LedgerValidationException("Account class is required");
        }
        try {
            return AccountClass.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new LedgerValidationException("Unknown account class: " + value, e);
        }
    }
}
