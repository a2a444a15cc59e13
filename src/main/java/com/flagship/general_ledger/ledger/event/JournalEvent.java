package com.flagship.general_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Event emitted through the outbox when the journal changes.
 */
public interface JournalEvent {

    String AGGREGATE_TYPE = "JournalEntry";

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getEntryId();

    String getEntryNumber();

    Instant getOccurredAt();

    String getEventType();
}
