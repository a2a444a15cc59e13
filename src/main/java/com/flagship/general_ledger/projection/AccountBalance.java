package com.flagship.general_ledger.projection;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Projected balance of one account.
 *
 * {@code balance} is signed by the account's normal side: a positive value
 * means the account holds a balance on its normal side. For header accounts
 * every figure is the sum of the direct children's figures.
 */
@Value
public class AccountBalance {
    UUID accountId;
    BigDecimal balance;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    long lineCount;
    UUID lastEntryId;
    Instant lastPostedAt;
    Instant projectedAt;

    public static AccountBalance zero(UUID accountId, Instant projectedAt) {
        return new AccountBalance(accountId, BigDecimal.ZERO.setScale(2), BigDecimal.ZERO.setScale(2),
            BigDecimal.ZERO.setScale(2), 0, null, null, projectedAt);
    }

    /**
     * Same figures, ignoring bookkeeping timestamps. Amounts compare by value.
     */
    public boolean sameFigures(AccountBalance other) {
        return other != null
            && accountId.equals(other.accountId)
            && balance.compareTo(other.balance) == 0
            && totalDebit.compareTo(other.totalDebit) == 0
            && totalCredit.compareTo(other.totalCredit) == 0
            && lineCount == other.lineCount;
    }
}
