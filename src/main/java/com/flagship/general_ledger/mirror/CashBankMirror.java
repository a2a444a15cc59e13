package com.flagship.general_ledger.mirror;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Cash and bank registers as an operational mirror.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CashBankMirror implements OperationalMirror {

    public static final String NAME = "cash-bank";

    private final CashBankRepository cashBankRepository;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean mirrors(UUID accountId) {
        return cashBankRepository.existsByAccountId(accountId);
    }

    @Override
    @Transactional(readOnly = true)
    public Set<UUID> mirroredAccountIds() {
        return new LinkedHashSet<>(cashBankRepository.findAllAccountIds());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BigDecimal> currentBalance(UUID accountId) {
        return cashBankRepository.findByAccountId(accountId).map(CashBankEntity::getBalance);
    }

    @Override
    @Transactional
    public MirrorBalance write(UUID accountId, BigDecimal projectedBalance) {
        CashBankEntity register = cashBankRepository.findByAccountId(accountId)
            .orElseThrow(() -> new IllegalStateException("No cash/bank register linked to account " + accountId));
        Instant now = Instant.now();
        BigDecimal previous = register.getBalance();
        register.applyLedgerBalance(projectedBalance, now);
        cashBankRepository.save(register);

        if (previous.compareTo(projectedBalance) != 0) {
            log.debug("Cash/bank {} balance {} -> {}", register.getCode(),
                    previous.toPlainString(), projectedBalance.toPlainString());
        }
        return new MirrorBalance(NAME, accountId, register.getId(), projectedBalance, now);
    }
}
