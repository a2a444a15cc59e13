package com.flagship.general_ledger.mirror;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountClass;
import com.flagship.general_ledger.account.AccountDirectory;
import com.flagship.general_ledger.ledger.exception.LedgerValidationException;
import com.flagship.general_ledger.projection.AccountBalanceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Registration of cash and bank registers.
 *
 * Money moves through a register only by posting journal entries against
 * its linked account; this service never touches a register's balance
 * except to seed it from the projection on registration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashBankRegisterService {

    private final CashBankRepository cashBankRepository;
    private final AccountDirectory accountDirectory;
    private final AccountBalanceStore balanceStore;

    /**
     * Links a new register to a postable ASSET account. At most one register
     * per account.
     */
    @Transactional
    public CashBank register(String code, String name, RegisterType registerType, String accountCode) {
        if (code == null || code.isBlank()) {
            throw new LedgerValidationException("Register code is required");
        }
        if (name == null || name.isBlank()) {
            throw new LedgerValidationException("Register name is required");
        }
        if (registerType == null) {
            throw new LedgerValidationException("Register type is required");
        }
        Account account = accountDirectory.requirePostable(accountCode);
        if (account.getAccountClass() != AccountClass.ASSET) {
            throw new LedgerValidationException(
                "Cash/bank register must link to an ASSET account, " + account.getCode() + " is "
                    + account.getAccountClass());
        }
        if (cashBankRepository.existsByAccountId(account.getId())) {
            throw new LedgerValidationException("Account " + account.getCode() + " already has a cash/bank register");
        }
        if (cashBankRepository.findByCode(code.trim()).isPresent()) {
            throw new LedgerValidationException("Cash/bank register code already exists: " + code);
        }

        CashBankEntity entity = CashBankEntity.create(code.trim(), name.trim(), registerType, account.getId());
        balanceStore.find(account.getId())
            .ifPresent(projected -> entity.applyLedgerBalance(projected.getBalance(), projected.getProjectedAt()));
        CashBankEntity saved = cashBankRepository.save(entity);

        log.info("Registered {} register {} on account {}", registerType, saved.getCode(), account.getCode());
        return CashBank.from(saved);
    }

    @Transactional
    public CashBank deactivate(String code) {
        CashBankEntity entity = cashBankRepository.findByCode(code)
            .orElseThrow(() -> new LedgerValidationException("Cash/bank register not found: " + code));
        entity.deactivate();
        log.info("Deactivated cash/bank register {}", code);
        return CashBank.from(cashBankRepository.save(entity));
    }

    @Transactional(readOnly = true)
    public Optional<CashBank> findByCode(String code) {
        return cashBankRepository.findByCode(code).map(CashBank::from);
    }

    @Transactional(readOnly = true)
    public List<CashBank> listRegisters() {
        return cashBankRepository.findAllByOrderByCodeAsc().stream()
            .map(CashBank::from)
            .toList();
    }
}
