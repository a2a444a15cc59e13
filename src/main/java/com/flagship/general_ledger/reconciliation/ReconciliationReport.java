package com.flagship.general_ledger.reconciliation;

import com.flagship.general_ledger.ledger.ConsistencyWarning;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What a reconciliation run found and what it rewrote.
 */
@Value
public class ReconciliationReport {
    Instant startedAt;
    Instant finishedAt;
    List<ConsistencyWarning> warnings;
    int accountsRematerialized;
    int mirrorsRefreshed;
    int mirrorFailures;
    int repairsCleared;

    public boolean isClean() {
        return warnings.isEmpty() && mirrorFailures == 0;
    }

    public List<ConsistencyWarning> warningsOfKind(ConsistencyWarning.Kind kind) {
        return warnings.stream().filter(w -> w.getKind() == kind).toList();
    }
}
