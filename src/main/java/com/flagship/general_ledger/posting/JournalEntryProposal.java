package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.ledger.IdempotencyKey;
import com.flagship.general_ledger.ledger.SourceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * A business service's request to record one financial effect.
 *
 * The (sourceType, sourceId, purpose) triple must be stable for the effect:
 * submitting the same triple again returns the entry already posted for it.
 * Distinct effects of one source record use distinct purposes, for example
 * ("SALE", "42", "INVOICE") and ("SALE", "42", "PAYMENT").
 */
@Value
@Builder
public class JournalEntryProposal {

    @NotNull(message = "source type is required")
    SourceType sourceType;

    @NotBlank(message = "source id is required")
    @Size(max = 100)
    String sourceId;

    @NotBlank(message = "purpose is required")
    @Size(max = 100)
    String purpose;

    @NotNull(message = "entry date is required")
    LocalDate entryDate;

    @NotBlank(message = "description is required")
    @Size(max = 500)
    String description;

    @Singular
    @Size(min = 2, message = "an entry needs at least two lines")
    @Valid
    List<ProposedLine> lines;

    public IdempotencyKey idempotencyKey() {
        return IdempotencyKey.of(sourceType, sourceId, purpose);
    }
}
