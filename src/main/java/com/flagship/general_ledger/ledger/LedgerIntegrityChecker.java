package com.flagship.general_ledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Verifies that every posted entry is balanced and that its stored totals
 * match its lines. Read-only; findings are returned, never corrected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerIntegrityChecker {

    private final LedgerStore ledgerStore;

    public List<ConsistencyWarning> check() {
        List<ConsistencyWarning> warnings = ledgerStore.findEntryTotalMismatches().stream()
            .map(m -> new ConsistencyWarning(
                ConsistencyWarning.Kind.ENTRY_TOTALS,
                m.getEntryId(),
                m.getEntryNumber(),
                m.getStoredDebit(),
                m.getLineDebit(),
                String.format("stored debit=%s credit=%s, lines debit=%s credit=%s",
                    m.getStoredDebit().toPlainString(), m.getStoredCredit().toPlainString(),
                    m.getLineDebit().toPlainString(), m.getLineCredit().toPlainString())))
            .toList();
        warnings.forEach(w -> log.warn("Journal entry totals mismatch: entryNumber={}, {}",
                w.getSubjectCode(), w.getDetail()));
        return warnings;
    }
}
