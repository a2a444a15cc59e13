package com.flagship.general_ledger.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    Optional<AccountEntity> findByCode(String code);

    List<AccountEntity> findByParentIdOrderByCodeAsc(UUID parentId);

    List<AccountEntity> findAllByOrderByCodeAsc();

    List<AccountEntity> findByHeaderFalseOrderByCodeAsc();

    List<AccountEntity> findByHeaderTrueOrderByCodeAsc();

    long countByParentIdAndActiveTrue(UUID parentId);
}
