package com.flagship.general_ledger.mirror;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * An operational entity type that keeps its own copy of a leaf account's
 * balance (a cash register, a bank account record).
 *
 * Implementations only ever receive the projected balance through
 * {@link #write}; they must not offer any other way to change it.
 */
public interface OperationalMirror {

    /**
     * Short name used in logs and results, e.g. "cash-bank".
     */
    String name();

    boolean mirrors(UUID accountId);

    Set<UUID> mirroredAccountIds();

    /**
     * The balance currently held by the record linked to the account.
     */
    Optional<BigDecimal> currentBalance(UUID accountId);

    /**
     * Overwrites the linked record's balance with the projected one.
     */
    MirrorBalance write(UUID accountId, BigDecimal projectedBalance);
}
