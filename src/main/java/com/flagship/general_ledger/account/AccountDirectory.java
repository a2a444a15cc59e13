package com.flagship.general_ledger.account;

import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.general_ledger.ledger.exception.LedgerValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only view of the chart of accounts.
 *
 * The posting path only ever reads the tree; structural changes go through
 * {@link ChartOfAccountsService}.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AccountDirectory {

    private final AccountRepository accountRepository;
    private final LedgerProperties ledgerProperties;

    /**
     * Resolves a code to an active account.
     *
     * @throws AccountNotFoundException if the code is unknown or the account is retired
     */
    public Account lookup(String code) {
        return findByCode(code)
            .filter(Account::isActive)
            .orElseThrow(() -> new AccountNotFoundException(code));
    }

    /**
     * Finds an account by code regardless of its active flag.
     */
    public Optional<Account> findByCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return accountRepository.findByCode(code.trim()).map(AccountEntity::toDomain);
    }

    public Account getById(UUID accountId) {
        return accountRepository.findById(accountId)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> new AccountNotFoundException(String.valueOf(accountId)));
    }

    public List<Account> children(UUID accountId) {
        return accountRepository.findByParentIdOrderByCodeAsc(accountId).stream()
            .map(AccountEntity::toDomain)
            .toList();
    }

    /**
     * Ancestors of an account ordered from its parent up to the root.
     *
     * @throws IllegalStateException if the parent chain is longer than the
     *         configured maximum depth, which means it loops
     */
    public List<Account> ancestors(UUID accountId) {
        Account current = getById(accountId);
        List<Account> ancestors = new ArrayList<>();
        int maxDepth = ledgerProperties.getHierarchy().getMaxDepth();
        while (current.getParentId() != null) {
            if (ancestors.size() >= maxDepth) {
                throw new IllegalStateException(
                    "Parent chain of account " + accountId + " exceeds depth " + maxDepth
                        + "; circular parent reference suspected");
            }
            current = getById(current.getParentId());
            ancestors.add(current);
        }
        return ancestors;
    }

    public boolean isHeader(UUID accountId) {
        return getById(accountId).isHeader();
    }

    /**
     * Resolves a code to an account that may receive journal lines.
     *
     * @throws AccountNotFoundException if the code does not resolve
     * @throws LedgerValidationException if the account is a header or retired
     */
    public Account requirePostable(String code) {
        Account account = findByCode(code).orElseThrow(() -> new AccountNotFoundException(code));
        if (account.isHeader()) {
            throw new LedgerValidationException(
                "Account " + account.getCode() + " (" + account.getName()
                    + ") is a header account and cannot be posted to directly");
        }
        if (!account.isActive()) {
            throw new LedgerValidationException(
                "Account " + account.getCode() + " (" + account.getName() + ") is inactive");
        }
        return account;
    }

    /**
     * Every account in code order, retired ones included.
     */
    public List<Account> allAccounts() {
        return accountRepository.findAllByOrderByCodeAsc().stream()
            .map(AccountEntity::toDomain)
            .toList();
    }

    /**
     * Leaf accounts, retired ones included: their history still counts.
     */
    public List<Account> leafAccounts() {
        return accountRepository.findByHeaderFalseOrderByCodeAsc().stream()
            .map(AccountEntity::toDomain)
            .toList();
    }

    /**
     * Header accounts ordered deepest level first, so that every header comes
     * after all headers below it.
     */
    public List<Account> headersBottomUp() {
        List<Account> headers = accountRepository.findByHeaderTrueOrderByCodeAsc().stream()
            .map(AccountEntity::toDomain)
            .toList();
        Map<UUID, Integer> depths = new HashMap<>();
        for (Account header : headers) {
            depths.put(header.getId(), depthOf(header.getId()));
        }
        return headers.stream()
            .sorted(Comparator.comparing((Account a) -> depths.get(a.getId())).reversed()
                .thenComparing(Account::getCode))
            .toList();
    }

    /**
     * Level of an account in the tree; roots are at depth 1.
     */
    public int depthOf(UUID accountId) {
        return ancestors(accountId).size() + 1;
    }
}
