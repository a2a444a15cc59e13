package com.flagship.general_ledger.mirror;

import com.flagship.general_ledger.ledger.exception.MirrorWriteException;
import com.flagship.general_ledger.projection.AccountBalance;
import com.flagship.general_ledger.projection.AccountBalanceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps operational balance copies equal to the projected ledger balance.
 *
 * Data flows one way only: projected balance to mirror. A mirror's figure is
 * never read back into the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OperationalMirrorAdapter {

    private final List<OperationalMirror> mirrors;
    private final AccountBalanceStore balanceStore;

    /**
     * Copies the projected balance of the account into its mirror record.
     *
     * @throws MirrorWriteException if no mirror is registered for the account,
     *         the account has no projected balance yet, or the write fails
     */
    public MirrorBalance refresh(UUID accountId) {
        OperationalMirror mirror = mirrorFor(accountId)
            .orElseThrow(() -> new MirrorWriteException(accountId, "no operational mirror registered"));
        AccountBalance projected = balanceStore.find(accountId)
            .orElseThrow(() -> new MirrorWriteException(accountId, "account has no projected balance"));
        try {
            MirrorBalance written = mirror.write(accountId, projected.getBalance());
            log.debug("Refreshed {} mirror of account {} to {}", mirror.name(), accountId,
                    written.getBalance().toPlainString());
            return written;
        } catch (RuntimeException e) {
            throw new MirrorWriteException(accountId, e.getMessage(), e);
        }
    }

    /**
     * Whether the mirror holds exactly the projected balance. An account
     * without a mirror is trivially consistent; a mirrored account that was
     * never projected is not.
     */
    public boolean validate(UUID accountId) {
        Optional<OperationalMirror> mirror = mirrorFor(accountId);
        if (mirror.isEmpty()) {
            return true;
        }
        Optional<BigDecimal> mirrored = mirror.get().currentBalance(accountId);
        Optional<AccountBalance> projected = balanceStore.find(accountId);
        if (mirrored.isEmpty() || projected.isEmpty()) {
            return false;
        }
        return mirrored.get().compareTo(projected.get().getBalance()) == 0;
    }

    public Optional<BigDecimal> mirroredBalance(UUID accountId) {
        return mirrorFor(accountId).flatMap(m -> m.currentBalance(accountId));
    }

    public boolean hasMirror(UUID accountId) {
        return mirrorFor(accountId).isPresent();
    }

    public Set<UUID> mirroredAccountIds() {
        Set<UUID> ids = new LinkedHashSet<>();
        for (OperationalMirror mirror : mirrors) {
            ids.addAll(mirror.mirroredAccountIds());
        }
        return ids;
    }

    private Optional<OperationalMirror> mirrorFor(UUID accountId) {
        return mirrors.stream().filter(m -> m.mirrors(accountId)).findFirst();
    }
}
