package com.flagship.general_ledger.projection;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountDirectory;
import com.flagship.general_ledger.ledger.ConsistencyWarning;
import com.flagship.general_ledger.ledger.LedgerStore;
import com.flagship.general_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Derives account balances from the journal. The only writer of
 * account_balances.
 *
 * Every projection is a full recomputation from committed data:
 * - a leaf is {@code normalSign(class) * (sum(debit) - sum(credit))} over its posted lines
 * - a header is the sum of its direct children's stored balances
 *
 * Nothing is adjusted incrementally, so repeating a projection, or running two
 * at once, converges on the same figures. Projection runs outside the posting
 * transaction and reads only committed lines.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceProjector {

    private final AccountDirectory accountDirectory;
    private final LedgerStore ledgerStore;
    private final AccountBalanceStore balanceStore;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Recomputes and stores the balance of one account: from its posted lines
     * for a leaf, from its children for a header.
     */
    public AccountBalance projectAccount(UUID accountId) {
        Account account = accountDirectory.getById(accountId);
        AccountBalance balance = account.isHeader() ? rollUp(account) : computeLeaf(account);
        balanceStore.save(balance);
        log.debug("Projected account {}: balance={}", account.getCode(), balance.getBalance());
        return balance;
    }

    /**
     * Recomputes every ancestor of the account, parent first, up to the root.
     */
    public List<AccountBalance> projectAncestors(UUID accountId) {
        List<AccountBalance> projected = new ArrayList<>();
        for (Account ancestor : accountDirectory.ancestors(accountId)) {
            AccountBalance balance = rollUp(ancestor);
            balanceStore.save(balance);
            projected.add(balance);
        }
        return projected;
    }

    /**
     * Projects a set of touched accounts and all their ancestors. Every
     * touched account comes first; the union of ancestors follows deepest
     * level first, so a header is only rolled up after each affected child.
     */
    public Map<UUID, AccountBalance> projectAffected(Collection<UUID> accountIds) {
        Map<UUID, AccountBalance> projected = new LinkedHashMap<>();
        Map<UUID, Account> ancestors = new HashMap<>();
        Map<UUID, Integer> depths = new HashMap<>();

        for (UUID accountId : accountIds) {
            projected.put(accountId, projectAccount(accountId));
            List<Account> chain = accountDirectory.ancestors(accountId);
            for (int i = 0; i < chain.size(); i++) {
                Account ancestor = chain.get(i);
                ancestors.put(ancestor.getId(), ancestor);
                // chain.size() - i is the ancestor's depth from the root
                depths.put(ancestor.getId(), chain.size() - i);
            }
        }

        ancestors.values().stream()
            .filter(a -> !projected.containsKey(a.getId()))
            .sorted(Comparator.comparing((Account a) -> depths.get(a.getId())).reversed()
                .thenComparing(Account::getCode))
            .forEach(header -> {
                AccountBalance balance = rollUp(header);
                balanceStore.save(balance);
                projected.put(header.getId(), balance);
            });
        return projected;
    }

    /**
     * Rebuilds every balance from the journal: all leaves from their lines,
     * then all headers bottom-up. Accounts without lines get a zero row.
     */
    public Map<UUID, AccountBalance> rematerializeAll() {
        Instant now = now();
        Map<UUID, LedgerStore.LineTotals> totals = ledgerStore.postedTotalsByAccount();
        Map<UUID, AccountBalance> rebuilt = new LinkedHashMap<>();

        for (Account leaf : accountDirectory.leafAccounts()) {
            LedgerStore.LineTotals lineTotals = totals.get(leaf.getId());
            AccountBalance balance = lineTotals == null
                ? AccountBalance.zero(leaf.getId(), now)
                : fromTotals(leaf, lineTotals, now);
            balanceStore.save(balance);
            rebuilt.put(leaf.getId(), balance);
        }
        for (Account header : accountDirectory.headersBottomUp()) {
            AccountBalance balance = sumOf(header, accountDirectory.children(header.getId()), rebuilt::get, now);
            balanceStore.save(balance);
            rebuilt.put(header.getId(), balance);
        }

        log.info("Rematerialized balances: accounts={}", rebuilt.size());
        return rebuilt;
    }

    /**
     * Compares every stored leaf balance with a recomputation from its lines.
     * A missing row counts as zero. Nothing is written.
     */
    public List<ConsistencyWarning> verifyLeaves() {
        Map<UUID, AccountBalance> stored = balanceStore.findAll();
        Map<UUID, LedgerStore.LineTotals> totals = ledgerStore.postedTotalsByAccount();
        List<ConsistencyWarning> warnings = new ArrayList<>();

        for (Account leaf : accountDirectory.leafAccounts()) {
            LedgerStore.LineTotals lineTotals = totals.get(leaf.getId());
            BigDecimal expected = lineTotals == null
                ? BigDecimal.ZERO
                : leaf.getAccountClass().signedBalance(lineTotals.getTotalDebit(), lineTotals.getTotalCredit());
            BigDecimal actual = balanceOf(stored.get(leaf.getId()));
            if (expected.compareTo(actual) != 0) {
                warnings.add(warn(new ConsistencyWarning(
                    ConsistencyWarning.Kind.LEAF_DRIFT, leaf.getId(), leaf.getCode(), expected, actual,
                    "stored leaf balance differs from its posted lines")));
            }
        }
        return warnings;
    }

    /**
     * Compares every stored header balance with the live sum of its direct
     * children's stored balances. Nothing is written.
     */
    public List<ConsistencyWarning> verifyRollups() {
        Map<UUID, AccountBalance> stored = balanceStore.findAll();
        List<ConsistencyWarning> warnings = new ArrayList<>();

        for (Account header : accountDirectory.headersBottomUp()) {
            BigDecimal expected = accountDirectory.children(header.getId()).stream()
                .map(child -> balanceOf(stored.get(child.getId())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal actual = balanceOf(stored.get(header.getId()));
            if (expected.compareTo(actual) != 0) {
                warnings.add(warn(new ConsistencyWarning(
                    ConsistencyWarning.Kind.HEADER_ROLLUP, header.getId(), header.getCode(), expected, actual,
                    "stored header balance differs from the sum of its children")));
            }
        }
        return warnings;
    }

    private AccountBalance computeLeaf(Account account) {
        return fromTotals(account, ledgerStore.postedTotals(account.getId()), now());
    }

    private AccountBalance fromTotals(Account account, LedgerStore.LineTotals totals, Instant now) {
        LedgerStore.LastPosted last = totals.getLastPosted();
        return new AccountBalance(
            account.getId(),
            scaled(account.getAccountClass().signedBalance(totals.getTotalDebit(), totals.getTotalCredit())),
            scaled(totals.getTotalDebit()),
            scaled(totals.getTotalCredit()),
            totals.getLineCount(),
            last != null ? last.getEntryId() : null,
            last != null ? last.getPostedAt() : null,
            now);
    }

    private AccountBalance rollUp(Account header) {
        Map<UUID, AccountBalance> stored = new HashMap<>();
        List<Account> children = accountDirectory.children(header.getId());
        for (Account child : children) {
            balanceStore.find(child.getId()).ifPresent(b -> stored.put(child.getId(), b));
        }
        return sumOf(header, children, stored::get, now());
    }

    private AccountBalance sumOf(Account header, List<Account> children,
                                 Function<UUID, AccountBalance> lookup, Instant now) {
        BigDecimal balance = BigDecimal.ZERO;
        BigDecimal debit = BigDecimal.ZERO;
        BigDecimal credit = BigDecimal.ZERO;
        long lines = 0;
        AccountBalance latest = null;
        for (Account child : children) {
            AccountBalance childBalance = lookup.apply(child.getId());
            if (childBalance == null) {
                continue;
            }
            balance = balance.add(childBalance.getBalance());
            debit = debit.add(childBalance.getTotalDebit());
            credit = credit.add(childBalance.getTotalCredit());
            lines += childBalance.getLineCount();
            if (childBalance.getLastPostedAt() != null
                && (latest == null || childBalance.getLastPostedAt().isAfter(latest.getLastPostedAt()))) {
                latest = childBalance;
            }
        }
        return new AccountBalance(
            header.getId(),
            scaled(balance),
            scaled(debit),
            scaled(credit),
            lines,
            latest != null ? latest.getLastEntryId() : null,
            latest != null ? latest.getLastPostedAt() : null,
            now);
    }

    private ConsistencyWarning warn(ConsistencyWarning warning) {
        ledgerMetrics.recordConsistencyWarning(warning.getKind());
        log.warn("Consistency warning: kind={}, account={}, expected={}, actual={}, {}",
                warning.getKind(), warning.getSubjectCode(),
                warning.getExpected().toPlainString(), warning.getActual().toPlainString(), warning.getDetail());
        return warning;
    }

    private static BigDecimal balanceOf(AccountBalance balance) {
        return balance != null ? balance.getBalance() : BigDecimal.ZERO;
    }

    private static BigDecimal scaled(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.UNNECESSARY);
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
