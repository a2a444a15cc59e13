package com.flagship.general_ledger.ledger.exception;

/**
 * The requested lifecycle transition is not allowed for the entry's current
 * status (for example voiding a draft or a reversal).
 */
public class IllegalEntryStateException extends IllegalStateException {

    public IllegalEntryStateException(String message) {
        super(message);
    }
}
