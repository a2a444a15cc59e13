package com.flagship.general_ledger.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the accounts table.
 *
 * There is no balance column here: balances live in the projection and are
 * written by the balance projector only.
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 20)
    private String code;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_class", nullable = false, updatable = false, length = 20)
    private AccountClass accountClass;

    @Column(name = "is_header", nullable = false)
    private boolean header;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "parent_id", updatable = false)
    private UUID parentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static AccountEntity create(String code, String name, AccountClass accountClass,
                                boolean header, UUID parentId) {
        return new AccountEntity(
            UUID.randomUUID(),
            code,
            name,
            accountClass,
            header,
            true,
            parentId,
            null, // set by @PrePersist
            null
        );
    }

    public Account toDomain() {
        return new Account(id, code, name, accountClass, header, active, parentId);
    }

    void retire() {
        this.active = false;
    }
}
