package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.ledger.exception.LedgerValidationException;
import lombok.Value;

/**
 * Identity of one business effect: at most one posted entry may exist per key.
 */
@Value
public class IdempotencyKey {
    SourceType sourceType;
    String sourceId;
    String purpose;

    public static IdempotencyKey of(SourceType sourceType, String sourceId, String purpose) {
        if (sourceType == null) {
            throw new LedgerValidationException("Source type is required");
        }
        if (sourceId == null || sourceId.isBlank()) {
            throw new LedgerValidationException("Source id is required");
        }
        if (purpose == null || purpose.isBlank()) {
            throw new LedgerValidationException("Purpose is required");
        }
        return new IdempotencyKey(sourceType, sourceId.trim(), purpose.trim());
    }

    /**
     * Key of the entry that reverses the entry numbered {@code entryNumber}.
     */
    public IdempotencyKey reversalOf(String entryNumber) {
        return new IdempotencyKey(sourceType, sourceId, "REVERSAL-OF-" + entryNumber);
    }

    /**
     * Compact form used as cache key and in log lines.
     */
    public String asString() {
        return sourceType + ":" + sourceId + ":" + purpose;
    }

    @Override
    public String toString() {
        return asString();
    }
}
