package com.flagship.general_ledger.ledger.exception;

import java.util.UUID;

/**
 * An operational mirror could not be refreshed from the projected balance.
 *
 * Never fatal to the posting that triggered the refresh; the account is queued
 * for repair instead.
 */
public class MirrorWriteException extends RuntimeException {

    public MirrorWriteException(UUID accountId, String message) {
        super("Mirror refresh failed for account " + accountId + ": " + message);
    }

    public MirrorWriteException(UUID accountId, String message, Throwable cause) {
        super("Mirror refresh failed for account " + accountId + ": " + message, cause);
    }
}
