package com.flagship.general_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A detected disagreement between two representations of the same figure.
 * Warnings are reported, never repaired silently by the check that found them.
 */
@Value
public class ConsistencyWarning {

    public enum Kind {
        /** Stored leaf balance differs from the sum of its posted lines. */
        LEAF_DRIFT,
        /** Stored header balance differs from the sum of its children. */
        HEADER_ROLLUP,
        /** Operational mirror differs from the projected balance. */
        MIRROR_DRIFT,
        /** A posted entry whose lines or totals do not balance. */
        ENTRY_TOTALS
    }

    Kind kind;
    UUID subjectId;
    String subjectCode;
    BigDecimal expected;
    BigDecimal actual;
    String detail;

    public BigDecimal difference() {
        BigDecimal e = expected != null ? expected : BigDecimal.ZERO;
        BigDecimal a = actual != null ? actual : BigDecimal.ZERO;
        return a.subtract(e);
    }
}
