package com.flagship.general_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in (or already published from) the outbox.
 *
 * Written in the same transaction as the journal change it describes, so an
 * event exists exactly when its entry committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "JournalEntry"
    UUID aggregateId;          // journal entry id
    String eventType;          // "JournalPosted", "JournalVoided"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * Whether the publisher has given up on this event.
     */
    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
