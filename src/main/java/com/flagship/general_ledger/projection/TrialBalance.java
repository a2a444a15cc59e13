package com.flagship.general_ledger.projection;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Leaf balances split into debit and credit columns. The ledger is in
 * balance when both columns total the same.
 */
@Value
public class TrialBalance {
    List<Row> rows;
    BigDecimal totalDebit;
    BigDecimal totalCredit;

    @Value
    public static class Row {
        String accountCode;
        String accountName;
        String accountClass;
        BigDecimal debit;
        BigDecimal credit;
    }

    public boolean isBalanced() {
        return totalDebit.compareTo(totalCredit) == 0;
    }
}
