package com.flagship.general_ledger.ledger;

import lombok.Value;

/**
 * Outcome of voiding an entry. {@code alreadyVoided} is set when the entry
 * was void before the call and nothing was written.
 */
@Value
public class VoidResult {
    JournalEntry original;
    JournalEntry reversal;
    boolean alreadyVoided;
}
