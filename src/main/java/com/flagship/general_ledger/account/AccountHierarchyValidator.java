package com.flagship.general_ledger.account;

import com.flagship.general_ledger.config.LedgerProperties;
import com.flagship.general_ledger.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Structural checks over the whole chart of accounts.
 *
 * Works on an in-memory snapshot of the tree, so a parent cycle is reported
 * rather than followed forever. Nothing is repaired.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccountHierarchyValidator {

    private final AccountDirectory accountDirectory;
    private final LedgerStore ledgerStore;
    private final LedgerProperties ledgerProperties;

    @Transactional(readOnly = true)
    public HierarchyValidationResult validate() {
        List<Account> accounts = accountDirectory.allAccounts();
        Map<UUID, Account> byId = new HashMap<>();
        Map<UUID, Integer> childCounts = new HashMap<>();
        for (Account account : accounts) {
            byId.put(account.getId(), account);
            if (account.getParentId() != null) {
                childCounts.merge(account.getParentId(), 1, Integer::sum);
            }
        }

        int maxDepth = ledgerProperties.getHierarchy().getMaxDepth();
        List<HierarchyIssue> issues = new ArrayList<>();
        for (Account account : accounts) {
            checkParentChain(account, byId, maxDepth, issues);

            Account parent = account.getParentId() != null ? byId.get(account.getParentId()) : null;
            if (parent != null && parent.getAccountClass() != account.getAccountClass()) {
                issues.add(issue(HierarchyIssue.Type.CLASS_MISMATCH, account,
                    String.format("Account %s is %s but its parent %s is %s",
                        account.getCode(), account.getAccountClass(), parent.getCode(), parent.getAccountClass())));
            }
            if (!account.isHeader() && childCounts.getOrDefault(account.getId(), 0) > 0) {
                issues.add(issue(HierarchyIssue.Type.LEAF_WITH_CHILDREN, account,
                    "Leaf account " + account.getCode() + " has "
                        + childCounts.get(account.getId()) + " child account(s)"));
            }
            if (account.isHeader() && ledgerStore.hasLines(account.getId())) {
                issues.add(issue(HierarchyIssue.Type.HEADER_WITH_LINES, account,
                    "Header account " + account.getCode() + " has journal lines posted directly to it"));
            }
        }

        issues.forEach(i -> log.warn("Chart of accounts issue: type={}, account={}, {}",
                i.getType(), i.getAccountCode(), i.getMessage()));
        log.info("Validated chart of accounts: accounts={}, issues={}", accounts.size(), issues.size());
        return new HierarchyValidationResult(accounts.size(), List.copyOf(issues));
    }

    private void checkParentChain(Account account, Map<UUID, Account> byId, int maxDepth,
                                  List<HierarchyIssue> issues) {
        Set<UUID> seen = new HashSet<>();
        seen.add(account.getId());
        Account current = account;
        int depth = 1;
        while (current.getParentId() != null) {
            Account parent = byId.get(current.getParentId());
            if (parent == null) {
                issues.add(issue(HierarchyIssue.Type.ORPHANED_ACCOUNT, current,
                    "Account " + current.getCode() + " references missing parent " + current.getParentId()));
                return;
            }
            if (!seen.add(parent.getId())) {
                issues.add(issue(HierarchyIssue.Type.CIRCULAR_REFERENCE, account,
                    "Parent chain of account " + account.getCode() + " loops back at " + parent.getCode()));
                return;
            }
            current = parent;
            depth++;
        }
        if (depth > maxDepth) {
            issues.add(issue(HierarchyIssue.Type.DEPTH_EXCEEDED, account,
                "Account " + account.getCode() + " is at depth " + depth + ", maximum is " + maxDepth));
        }
    }

    private static HierarchyIssue issue(HierarchyIssue.Type type, Account account, String message) {
        return new HierarchyIssue(type, account.getId(), account.getCode(), message);
    }
}
