package com.flagship.general_ledger.ledger.event;

import com.flagship.general_ledger.ledger.VoidResult;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class JournalVoidedEvent implements JournalEvent {

    public static final String EVENT_TYPE = "JournalVoided";

    UUID eventId;
    UUID entryId;
    String entryNumber;
    UUID reversalEntryId;
    String reversalEntryNumber;
    String reason;
    Instant occurredAt;

    public static JournalVoidedEvent from(VoidResult result) {
        return new JournalVoidedEvent(
            UUID.randomUUID(),
            result.getOriginal().getId(),
            result.getOriginal().getEntryNumber(),
            result.getReversal().getId(),
            result.getReversal().getEntryNumber(),
            result.getOriginal().getVoidReason(),
            Instant.now()
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
