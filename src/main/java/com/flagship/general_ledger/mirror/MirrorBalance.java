package com.flagship.general_ledger.mirror;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The balance held by one operational record after a refresh.
 */
@Value
public class MirrorBalance {
    String mirrorName;
    UUID accountId;
    UUID recordId;
    BigDecimal balance;
    Instant refreshedAt;
}
