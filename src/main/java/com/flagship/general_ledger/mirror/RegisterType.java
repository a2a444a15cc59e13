package com.flagship.general_ledger.mirror;

public enum RegisterType {
    CASH,
    BANK
}
