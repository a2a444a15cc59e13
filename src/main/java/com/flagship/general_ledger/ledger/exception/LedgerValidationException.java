package com.flagship.general_ledger.ledger.exception;

/**
 * Raised when a proposal is malformed or violates a posting rule.
 *
 * Rejections of this kind happen before anything is persisted; the caller can
 * fix the proposal and submit it again.
 */
public class LedgerValidationException extends IllegalArgumentException {

    public LedgerValidationException(String message) {
        super(message);
    }

    public LedgerValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
