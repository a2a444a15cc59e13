package com.flagship.general_ledger.mirror;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class CashBank {
    UUID id;
    String code;
    String name;
    RegisterType registerType;
    UUID accountId;
    BigDecimal balance;
    boolean active;
    Instant balanceRefreshedAt;

    static CashBank from(CashBankEntity entity) {
        return new CashBank(
            entity.getId(),
            entity.getCode(),
            entity.getName(),
            entity.getRegisterType(),
            entity.getAccountId(),
            entity.getBalance(),
            entity.isActive(),
            entity.getBalanceRefreshedAt());
    }
}
