package com.flagship.general_ledger.ledger.exception;

import com.flagship.general_ledger.ledger.IdempotencyKey;
import lombok.Getter;

/**
 * The idempotency key of an append is already owned by a posted entry.
 *
 * Thrown by the ledger store so that the append transaction rolls back.
 * The posting engine answers it with the entry that owns the key, so callers
 * of {@code post} never see this exception.
 */
@Getter
public class DuplicatePostingException extends IllegalStateException {

    private final IdempotencyKey idempotencyKey;

    public DuplicatePostingException(IdempotencyKey idempotencyKey, Throwable cause) {
        super("Journal entry already posted for " + idempotencyKey, cause);
        this.idempotencyKey = idempotencyKey;
    }
}
