package com.flagship.general_ledger.account;

import lombok.Value;

import java.util.UUID;

/**
 * One structural problem found in the chart of accounts.
 */
@Value
public class HierarchyIssue {

    public enum Type {
        CIRCULAR_REFERENCE,
        ORPHANED_ACCOUNT,
        CLASS_MISMATCH,
        DEPTH_EXCEEDED,
        LEAF_WITH_CHILDREN,
        HEADER_WITH_LINES
    }

    Type type;
    UUID accountId;
    String accountCode;
    String message;
}
