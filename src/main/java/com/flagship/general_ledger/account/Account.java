package com.flagship.general_ledger.account;

import lombok.Value;

import java.util.UUID;

/**
 * Node in the chart of accounts.
 *
 * Header accounts only aggregate their children and are never posting
 * targets. Accounts are retired by clearing {@code active}; they are not
 * deleted while journal lines reference them.
 */
@Value
public class Account {
    UUID id;
    String code;
    String name;
    AccountClass accountClass;
    boolean header;
    boolean active;
    UUID parentId;

    public boolean isPostable() {
        return active && !header;
    }

    public boolean isRoot() {
        return parentId == null;
    }
}
