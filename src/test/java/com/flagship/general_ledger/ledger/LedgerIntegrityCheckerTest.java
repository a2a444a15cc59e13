package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.LedgerTestSupport;
import com.flagship.general_ledger.posting.PostedEntry;
import com.flagship.general_ledger.posting.PostingEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LedgerIntegrityCheckerTest extends LedgerTestSupport {

    @Autowired
    private LedgerIntegrityChecker integrityChecker;

    @Autowired
    private PostingEngine postingEngine;

    @Test
    @DisplayName("Entries written by the engine pass the check")
    void postedEntriesAreConsistent() {
        PostedEntry posted = postingEngine.post(saleInvoice("42"));
        postingEngine.voidEntry(posted.getId(), "Cancelled");

        assertTrue(integrityChecker.check().isEmpty());
    }

    @Test
    @DisplayName("Stored totals that disagree with the lines are reported")
    void tamperedTotalsAreReported() {
        PostedEntry posted = postingEngine.post(saleInvoice("42"));
        jdbcTemplate.update("UPDATE journal_entries SET total_debit = 999, total_credit = 999 WHERE id = ?",
                posted.getId());

        List<ConsistencyWarning> warnings = integrityChecker.check();

        assertEquals(1, warnings.size());
        ConsistencyWarning warning = warnings.get(0);
        assertEquals(ConsistencyWarning.Kind.ENTRY_TOTALS, warning.getKind());
        assertEquals(posted.getId(), warning.getSubjectId());
        assertEquals(posted.getEntryNumber(), warning.getSubjectCode());
        assertAmount("999.00", warning.getExpected());
        assertAmount("2220000.00", warning.getActual());
    }
}
