package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.ledger.JournalEntry;
import lombok.Value;

import java.util.UUID;

/**
 * Result of a posting call.
 *
 * {@code duplicate} is set when the key was already posted and the existing
 * entry is returned. {@code balancesCurrent} is false when the entry is
 * durable but its balance or mirror refresh failed and was queued for repair.
 */
@Value
public class PostedEntry {
    JournalEntry entry;
    boolean duplicate;
    boolean balancesCurrent;

    public UUID getId() {
        return entry.getId();
    }

    public String getEntryNumber() {
        return entry.getEntryNumber();
    }
}
