package com.flagship.general_ledger.account;

import lombok.Value;

import java.util.List;

@Value
public class HierarchyValidationResult {
    int accountsChecked;
    List<HierarchyIssue> issues;

    public boolean isValid() {
        return issues.isEmpty();
    }

    public List<HierarchyIssue> issuesOfType(HierarchyIssue.Type type) {
        return issues.stream().filter(i -> i.getType() == type).toList();
    }
}
