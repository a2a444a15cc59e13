package com.flagship.general_ledger.projection;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountClass;
import com.flagship.general_ledger.account.AccountDirectory;
import com.flagship.general_ledger.ledger.AccountLedgerLine;
import com.flagship.general_ledger.ledger.LedgerStore;
import com.flagship.general_ledger.ledger.exception.AccountNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Read accessors over projected balances for reporting collaborators.
 *
 * Stored balances keep their natural sign; the display convention is only
 * applied here, on figures that are already aggregated.
 */
@Service
@RequiredArgsConstructor
public class BalanceQueryService {

    private final AccountDirectory accountDirectory;
    private final AccountBalanceStore balanceStore;
    private final LedgerStore ledgerStore;

    /**
     * Signed balance of an account; zero if it was never projected.
     */
    public BigDecimal balanceOf(UUID accountId) {
        return balanceStore.find(accountId)
            .map(AccountBalance::getBalance)
            .orElse(BigDecimal.ZERO.setScale(2));
    }

    public BigDecimal balanceOf(String accountCode) {
        Account account = accountDirectory.findByCode(accountCode)
            .orElseThrow(() -> new AccountNotFoundException(accountCode));
        return balanceOf(account.getId());
    }

    /**
     * Report-facing figure: absolute value for credit-normal classes.
     */
    public BigDecimal displayBalanceOf(String accountCode) {
        Account account = accountDirectory.findByCode(accountCode)
            .orElseThrow(() -> new AccountNotFoundException(accountCode));
        return account.getAccountClass().toDisplay(balanceOf(account.getId()));
    }

    public Map<UUID, AccountBalance> allBalances() {
        return balanceStore.findAll();
    }

    /**
     * Trial balance over leaf accounts. A positive balance lands on the
     * account's normal side, a negative one on the opposite side.
     */
    public TrialBalance trialBalance() {
        Map<UUID, AccountBalance> balances = balanceStore.findAll();
        List<TrialBalance.Row> rows = new ArrayList<>();
        BigDecimal totalDebit = BigDecimal.ZERO.setScale(2);
        BigDecimal totalCredit = BigDecimal.ZERO.setScale(2);

        for (Account leaf : accountDirectory.leafAccounts()) {
            AccountBalance balance = balances.get(leaf.getId());
            if (balance == null || balance.getBalance().signum() == 0) {
                continue;
            }
            AccountClass accountClass = leaf.getAccountClass();
            // Natural debit-minus-credit figure
            BigDecimal net = balance.getBalance().multiply(accountClass.normalSign());
            BigDecimal debit = net.signum() > 0 ? net : BigDecimal.ZERO.setScale(2);
            BigDecimal credit = net.signum() < 0 ? net.negate() : BigDecimal.ZERO.setScale(2);
            rows.add(new TrialBalance.Row(leaf.getCode(), leaf.getName(), accountClass.name(), debit, credit));
            totalDebit = totalDebit.add(debit);
            totalCredit = totalCredit.add(credit);
        }
        return new TrialBalance(List.copyOf(rows), totalDebit, totalCredit);
    }

    /**
     * Posted lines of an account in posting order, each with the signed
     * balance after it. Lines of voided entries and their reversals both
     * appear.
     */
    public List<AccountStatementLine> statement(String accountCode) {
        Account account = accountDirectory.findByCode(accountCode)
            .orElseThrow(() -> new AccountNotFoundException(accountCode));
        AccountClass accountClass = account.getAccountClass();

        List<AccountStatementLine> statement = new ArrayList<>();
        BigDecimal running = BigDecimal.ZERO.setScale(2);
        try (Stream<AccountLedgerLine> lines = ledgerStore.linesForAccount(account.getId())) {
            for (AccountLedgerLine line : (Iterable<AccountLedgerLine>) lines::iterator) {
                running = running.add(accountClass.signedBalance(line.getDebit(), line.getCredit()));
                statement.add(new AccountStatementLine(
                    line.getEntryId(),
                    line.getEntryNumber(),
                    line.getEntryDate(),
                    line.getPostedAt(),
                    line.getDescription(),
                    line.getDebit(),
                    line.getCredit(),
                    running));
            }
        }
        return statement;
    }
}
