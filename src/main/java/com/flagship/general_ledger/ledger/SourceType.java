package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.ledger.exception.LedgerValidationException;

import java.util.Locale;

/**
 * Origin of a journal entry. Together with the source id and purpose it forms
 * the idempotency key of a posting, and it selects the entry-number prefix.
 */
public enum SourceType {
    SALE("SJ"),
    PURCHASE("PJ"),
    PAYMENT("PY"),
    CASH_BANK("CB"),
    ASSET("AJ"),
    MANUAL("JE"),
    OPENING("JE"),
    CLOSING("JE"),
    ADJUSTMENT("JE"),
    TRANSFER("JE"),
    DEPRECIATION("JE");

    /** Prefix used for entries that reverse a voided entry. */
    public static final String REVERSAL_PREFIX = "RV";

    private final String entryPrefix;

    SourceType(String entryPrefix) {
        this.entryPrefix = entryPrefix;
    }

    public String entryPrefix() {
        return entryPrefix;
    }

    /**
     * Case-insensitive parse; "cash-bank" and "cash_bank" are accepted alike.
     */
    public static SourceType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new LedgerValidationException("Source type is required");
        }
        try {
            return SourceType.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new LedgerValidationException("Unknown source type: " + value, e);
        }
    }
}
