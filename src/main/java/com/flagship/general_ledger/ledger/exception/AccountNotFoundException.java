package com.flagship.general_ledger.ledger.exception;

/**
 * An account code or id did not resolve to an account in the directory.
 */
public class AccountNotFoundException extends LedgerValidationException {

    public AccountNotFoundException(String reference) {
        super("Account not found: " + reference);
    }
}
