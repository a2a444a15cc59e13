package com.flagship.general_ledger.mirror;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A cash or bank register linked to one leaf ledger account.
 *
 * The balance column is a mirror: it is only changed by
 * {@link #applyLedgerBalance}, which is reachable from this package alone and
 * called with the projected balance of the linked account.
 */
@Entity
@Table(name = "cash_banks")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CashBankEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 30)
    private String code;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "register_type", nullable = false, updatable = false, length = 10)
    private RegisterType registerType;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(nullable = false, precision = 22, scale = 2)
    private BigDecimal balance;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "balance_refreshed_at")
    private Instant balanceRefreshedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static CashBankEntity create(String code, String name, RegisterType registerType, UUID accountId) {
        return new CashBankEntity(
            UUID.randomUUID(),
            code,
            name,
            registerType,
            accountId,
            BigDecimal.ZERO.setScale(2),
            true,
            null,
            null // set by @PrePersist
        );
    }

    void applyLedgerBalance(BigDecimal projectedBalance, Instant refreshedAt) {
        this.balance = projectedBalance;
        this.balanceRefreshedAt = refreshedAt;
    }

    void deactivate() {
        this.active = false;
    }
}
