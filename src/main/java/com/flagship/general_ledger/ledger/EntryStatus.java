package com.flagship.general_ledger.ledger;

/**
 * Lifecycle of a journal entry.
 *
 * DRAFT entries carry lines but affect no balance. POSTED entries are final.
 * VOID entries keep their lines and are offset by a posted reversing entry.
 */
public enum EntryStatus {
    DRAFT,
    POSTED,
    VOID;

    /**
     * Whether the entry's lines count toward balances.
     */
    public boolean affectsBalances() {
        return this != DRAFT;
    }
}
