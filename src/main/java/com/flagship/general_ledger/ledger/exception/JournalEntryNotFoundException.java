package com.flagship.general_ledger.ledger.exception;

import java.util.UUID;

public class JournalEntryNotFoundException extends LedgerValidationException {

    public JournalEntryNotFoundException(UUID entryId) {
        super("Journal entry not found: " + entryId);
    }
}
