package com.flagship.general_ledger.account;

import com.flagship.general_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.general_ledger.ledger.exception.LedgerValidationException;
import com.flagship.general_ledger.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Maintenance of the chart-of-accounts tree.
 *
 * Rules enforced on creation:
 * - codes are unique
 * - a parent must exist and be a header account
 * - a child has the same class as its parent
 *
 * Accounts are retired, never deleted. A leaf can only be retired when its
 * posted lines net to zero.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChartOfAccountsService {

    private final AccountRepository accountRepository;
    private final LedgerStore ledgerStore;

    @Transactional
    public Account createAccount(String code, String name, AccountClass accountClass,
                                 boolean header, String parentCode) {
        if (code == null || code.isBlank()) {
            throw new LedgerValidationException("Account code is required");
        }
        if (name == null || name.isBlank()) {
            throw new LedgerValidationException("Account name is required");
        }
        if (accountClass == null) {
            throw new LedgerValidationException("Account class is required");
        }
        String normalizedCode = code.trim();
        if (accountRepository.findByCode(normalizedCode).isPresent()) {
            throw new LedgerValidationException("Account code already exists: " + normalizedCode);
        }

        UUID parentId = null;
        if (parentCode != null && !parentCode.isBlank()) {
            AccountEntity parent = accountRepository.findByCode(parentCode.trim())
                .orElseThrow(() -> new AccountNotFoundException(parentCode));
            if (!parent.isHeader()) {
                throw new LedgerValidationException(
                    "Parent account " + parent.getCode() + " is not a header account");
            }
            if (!parent.isActive()) {
                throw new LedgerValidationException(
                    "Parent account " + parent.getCode() + " is inactive");
            }
            if (parent.getAccountClass() != accountClass) {
                throw new LedgerValidationException(String.format(
                    "Account class %s does not match parent %s class %s",
                    accountClass, parent.getCode(), parent.getAccountClass()));
            }
            parentId = parent.getId();
        }

        AccountEntity saved = accountRepository.save(
            AccountEntity.create(normalizedCode, name.trim(), accountClass, header, parentId));
        log.info("Created account: code={}, class={}, header={}, parent={}",
                saved.getCode(), accountClass, header, parentCode);
        return saved.toDomain();
    }

    /**
     * Soft-retires an account. Retired accounts keep their history and
     * balances but can no longer be posted to.
     */
    @Transactional
    public Account retireAccount(String code) {
        AccountEntity entity = accountRepository.findByCode(code)
            .orElseThrow(() -> new AccountNotFoundException(code));
        if (!entity.isActive()) {
            return entity.toDomain();
        }
        if (entity.isHeader() && accountRepository.countByParentIdAndActiveTrue(entity.getId()) > 0) {
            throw new LedgerValidationException(
                "Header account " + code + " still has active child accounts");
        }
        if (!entity.isHeader()) {
            // From the journal, not account_balances: a stale projection must not let money disappear.
            LedgerStore.LineTotals totals = ledgerStore.postedTotals(entity.getId());
            BigDecimal balance = entity.getAccountClass().signedBalance(totals.getTotalDebit(), totals.getTotalCredit());
            if (balance.signum() != 0) {
                throw new LedgerValidationException(
                    "Account " + code + " has a non-zero balance of " + balance.toPlainString());
            }
        }
        entity.retire();
        log.info("Retired account: code={}", code);
        return accountRepository.save(entity).toDomain();
    }
}
