package com.flagship.general_ledger.mirror;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CashBankRepository extends JpaRepository<CashBankEntity, UUID> {

    Optional<CashBankEntity> findByAccountId(UUID accountId);

    Optional<CashBankEntity> findByCode(String code);

    boolean existsByAccountId(UUID accountId);

    List<CashBankEntity> findAllByOrderByCodeAsc();

    @Query("SELECT c.accountId FROM CashBankEntity c")
    List<UUID> findAllAccountIds();
}
